package dao.fhe.settle.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "rpc")
public class RpcLedgerConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(LedgerProperties props) {
        if (props.getContractAddress() == null || props.getContractAddress().isBlank()) {
            throw new IllegalStateException("ledger.contract-address is required when ledger.mode=rpc");
        }
        log.info("EVM ledger: rpc={}, contract={}, chainId={}", props.getRpcUrl(), props.getContractAddress(), props.getChainId());
        return Web3j.build(new HttpService(props.getRpcUrl()));
    }
}
