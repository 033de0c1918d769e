package dao.fhe.settle.config;

import dao.fhe.settle.service.OperatorIdentity;
import dao.fhe.settle.util.BackoffRetrier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class EngineConfiguration {

    public static final String LEDGER_RETRIER = "ledgerRetrier";
    public static final String DECRYPT_RETRIER = "decryptRetrier";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperatorIdentity operatorIdentity(LedgerProperties props) {
        return OperatorIdentity.fromPrivateKey(props.getPrivateKey());
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CipherProperties cipherProps) {
        Duration timeout = Duration.ofMillis(cipherProps.getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    @Qualifier(LEDGER_RETRIER)
    public BackoffRetrier ledgerRetrier(LedgerProperties props) {
        return toRetrier(props.getRetry());
    }

    @Bean
    @Qualifier(DECRYPT_RETRIER)
    public BackoffRetrier decryptRetrier(CipherProperties props) {
        return toRetrier(props.getRetry());
    }

    private static BackoffRetrier toRetrier(RetrySettings settings) {
        return new BackoffRetrier(settings.getMaxAttempts(), settings.getInitialBackoffMs(), settings.getMaxBackoffMs());
    }
}
