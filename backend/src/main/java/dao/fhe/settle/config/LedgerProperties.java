package dao.fhe.settle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /** "local" (in-process accumulator) or "rpc" (EVM JSON-RPC hook contract). */
    private String mode = "local";

    private String rpcUrl = "http://127.0.0.1:8545";
    private String contractAddress;
    /** Operator key, hex. Blank means an ephemeral key is generated at startup. */
    private String privateKey;
    private long chainId = 31337L;
    private long gasLimit = 5_000_000L;

    private Polling polling = new Polling();
    private RetrySettings retry = new RetrySettings();

    @Data
    public static class Polling {
        private long receiptTimeoutSeconds = 60;
        private long receiptPollInitialMs = 250;
        private long receiptPollMaxMs = 2000;
    }
}
