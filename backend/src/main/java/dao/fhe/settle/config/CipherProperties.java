package dao.fhe.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "cipher")
public class CipherProperties {

    /** "mock" (in-process handles, local chains) or "gateway" (threshold network HTTP API). */
    private String mode = "mock";

    private String gatewayUrl = "http://127.0.0.1:8448";
    private long timeoutMs = 5000;

    private RetrySettings retry = new RetrySettings();
}
