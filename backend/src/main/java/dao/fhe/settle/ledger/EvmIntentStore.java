package dao.fhe.settle.ledger;

import dao.fhe.settle.config.EngineConfiguration;
import dao.fhe.settle.config.LedgerProperties;
import dao.fhe.settle.event.BatchFinalizedEvent;
import dao.fhe.settle.event.BatchFinalizedEventDecoder;
import dao.fhe.settle.event.LogDecodeResult;
import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.exception.NetworkTransientException;
import dao.fhe.settle.model.Batch;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.model.TypeTag;
import dao.fhe.settle.service.OperatorIdentity;
import dao.fhe.settle.service.SettlementAbi;
import dao.fhe.settle.util.BackoffRetrier;
import dao.fhe.settle.util.HexUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Intent hook contract over EVM JSON-RPC.
 * <p>
 * Reads are retried with backoff on {@link NetworkTransientException}. Transactions are
 * sent once; the caller decides whether to try again.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "rpc")
public class EvmIntentStore implements IntentStore {

    public static final String INTENT_SUBMITTED_SIGNATURE = "IntentSubmitted(bytes32,bytes32,address,uint64)";
    private static final String INTENT_SUBMITTED_TOPIC0 = Hash.sha3String(INTENT_SUBMITTED_SIGNATURE);
    // first 4 bytes of keccak256(signature), 0x-prefixed
    static final String SETTLE_BATCH_SELECTOR = Hash.sha3String(SettlementAbi.SETTLE_BATCH_SIGNATURE).substring(0, 10);
    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;
    private final TransactionManager txManager;
    private final String contractAddress;
    private final OperatorIdentity operator;
    private final BatchFinalizedEventDecoder eventDecoder;
    private final BackoffRetrier retrier;
    private final LedgerProperties.Polling polling;
    private final BigInteger gasLimit;
    /**
     * Serializes nonce assignment and broadcast. Receipt polling happens outside the lock.
     */
    private final Object broadcastLock = new Object();

    public EvmIntentStore(Web3j web3j,
                          LedgerProperties props,
                          OperatorIdentity operator,
                          BatchFinalizedEventDecoder eventDecoder,
                          @Qualifier(EngineConfiguration.LEDGER_RETRIER) BackoffRetrier retrier) {
        this.web3j = web3j;
        this.contractAddress = props.getContractAddress();
        this.operator = operator;
        this.eventDecoder = eventDecoder;
        this.retrier = retrier;
        this.polling = props.getPolling();
        this.gasLimit = BigInteger.valueOf(props.getGasLimit());
        this.txManager = new RawTransactionManager(web3j, operator.credentials(), props.getChainId());
        log.info("EvmIntentStore initialized: operator={}, contract={}", operator.address(), contractAddress);
    }

    @Override
    public String submitIntent(IntentSubmission submission) {
        EncryptedValue amount = submission.encryptedAmount();
        Function fn = new Function(
                "submitIntent",
                Arrays.asList(
                        new Bytes32(HexUtil.bytes32(submission.poolId())),
                        new Address(submission.tokenIn()),
                        new Address(submission.tokenOut()),
                        new Uint256(amount.handle()),
                        new Uint8(BigInteger.valueOf(amount.securityZone())),
                        new Uint8(BigInteger.valueOf(amount.tag().code())),
                        new DynamicBytes(Numeric.hexStringToByteArray(amount.proof())),
                        new Uint64(BigInteger.valueOf(submission.deadline()))
                ),
                Collections.emptyList()
        );
        TransactionReceipt receipt = sendTransaction("submitIntent", FunctionEncoder.encode(fn));
        for (Log l : receipt.getLogs()) {
            List<String> topics = l.getTopics();
            if (topics.size() >= 2 && INTENT_SUBMITTED_TOPIC0.equalsIgnoreCase(topics.get(0))) {
                String intentId = HexUtil.normalizeBytes32(topics.get(1));
                log.info("Intent {} submitted on-chain: tx={}", intentId, receipt.getTransactionHash());
                return intentId;
            }
        }
        throw new IllegalStateException("submitIntent succeeded without an IntentSubmitted event, tx=" + receipt.getTransactionHash());
    }

    @Override
    public long currentBlock() {
        return retrier.call("eth_blockNumber", NetworkTransientException.class, () -> {
            try {
                return web3j.ethBlockNumber().send().getBlockNumber().longValueExact();
            } catch (IOException e) {
                throw new NetworkTransientException("eth_blockNumber failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public List<BatchFinalizedEvent> findBatchFinalized(long fromBlock, long toBlock) {
        EthFilter filter = new EthFilter(
                DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
                DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
                contractAddress);
        filter.addSingleTopic(BatchFinalizedEventDecoder.TOPIC0);

        EthLog ethLog = retrier.call("eth_getLogs", NetworkTransientException.class, () -> {
            try {
                EthLog resp = web3j.ethGetLogs(filter).send();
                if (resp.hasError()) {
                    throw new NetworkTransientException("eth_getLogs failed: " + resp.getError().getMessage());
                }
                return resp;
            } catch (IOException e) {
                throw new NetworkTransientException("eth_getLogs failed: " + e.getMessage(), e);
            }
        });

        List<BatchFinalizedEvent> events = new ArrayList<>();
        for (EthLog.LogResult<?> result : ethLog.getLogs()) {
            if (!(result instanceof EthLog.LogObject logObject)) {
                continue;
            }
            Log l = logObject.get();
            LogDecodeResult<BatchFinalizedEvent> decoded =
                    eventDecoder.decode(l.getTopics(), l.getData(), l.getBlockNumber().longValue());
            if (decoded instanceof LogDecodeResult.Matched<BatchFinalizedEvent> matched) {
                events.add(matched.event());
            } else if (decoded instanceof LogDecodeResult.Malformed<BatchFinalizedEvent> malformed) {
                log.warn("Skipping malformed BatchFinalized log in tx {}: {}", l.getTransactionHash(), malformed.reason());
            }
        }
        return events;
    }

    @Override
    public Optional<Batch> getBatch(String batchId) {
        Function fn = new Function(
                "getBatch",
                Collections.singletonList(new Bytes32(HexUtil.bytes32(batchId))),
                Arrays.asList(
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Uint64>() {},
                        new TypeReference<Bool>() {},
                        new TypeReference<Bool>() {},
                        new TypeReference<Uint64>() {},
                        new TypeReference<DynamicArray<Bytes32>>() {}
                )
        );
        List<Type> decoded = callAndDecode(fn, 6);
        byte[] poolId = ((Bytes32) decoded.get(0)).getValue();
        if (new BigInteger(1, poolId).signum() == 0) {
            return Optional.empty();
        }
        boolean finalized = ((Bool) decoded.get(2)).getValue();
        boolean settled = ((Bool) decoded.get(3)).getValue();
        @SuppressWarnings("unchecked")
        DynamicArray<Bytes32> ids = (DynamicArray<Bytes32>) decoded.get(5);

        Batch batch = new Batch();
        batch.setId(HexUtil.normalizeBytes32(batchId));
        batch.setPoolId(Numeric.toHexString(poolId));
        batch.setCreatedBlock(((Uint64) decoded.get(1)).getValue().longValue());
        batch.setFinalizedAt(((Uint64) decoded.get(4)).getValue().longValue());
        batch.setState(settled ? BatchState.SETTLED : finalized ? BatchState.FINALIZED : BatchState.OPEN);
        List<String> intentIds = new ArrayList<>();
        for (Bytes32 id : ids.getValue()) {
            intentIds.add(Numeric.toHexString(id.getValue()));
        }
        batch.setIntentIds(intentIds);
        return Optional.of(batch);
    }

    /**
     * @throws dao.fhe.settle.exception.UnsupportedTagException when the stored utype is unknown
     */
    @Override
    public Optional<Intent> getIntent(String intentId) {
        Function fn = new Function(
                "getIntent",
                Collections.singletonList(new Bytes32(HexUtil.bytes32(intentId))),
                Arrays.asList(
                        new TypeReference<Address>() {},
                        new TypeReference<Address>() {},
                        new TypeReference<Address>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint8>() {},
                        new TypeReference<Uint8>() {},
                        new TypeReference<Bytes32>() {},
                        new TypeReference<Uint64>() {},
                        new TypeReference<Uint64>() {}
                )
        );
        List<Type> decoded = callAndDecode(fn, 9);
        String submitter = ((Address) decoded.get(0)).getValue();
        if (ZERO_ADDRESS.equalsIgnoreCase(submitter)) {
            return Optional.empty();
        }
        TypeTag tag = TypeTag.fromCode(((Uint8) decoded.get(5)).getValue().intValue());
        EncryptedValue amount = new EncryptedValue(
                ((Uint256) decoded.get(3)).getValue(),
                tag,
                ((Uint8) decoded.get(4)).getValue().intValue(),
                "0x");
        return Optional.of(Intent.builder()
                .id(HexUtil.normalizeBytes32(intentId))
                .submitter(Keys.toChecksumAddress(submitter))
                .tokenIn(Keys.toChecksumAddress(((Address) decoded.get(1)).getValue()))
                .tokenOut(Keys.toChecksumAddress(((Address) decoded.get(2)).getValue()))
                .encryptedAmount(amount)
                .poolId(Numeric.toHexString(((Bytes32) decoded.get(6)).getValue()))
                .submittedAt(((Uint64) decoded.get(7)).getValue().longValue())
                .deadline(((Uint64) decoded.get(8)).getValue().longValue())
                .build());
    }

    @Override
    public SettlementReceipt submitSettlement(PublishedSettlement settlement) {
        TransactionReceipt receipt = sendTransaction("settleBatch", encodeSettleBatch(settlement));
        return new SettlementReceipt(settlement.batchId(), receipt.getTransactionHash(), receipt.getBlockNumber().longValue());
    }

    /** Calldata for {@code settleBatch}: 4-byte selector followed by the ABI-encoded arguments. */
    @SuppressWarnings("rawtypes")
    static String encodeSettleBatch(PublishedSettlement settlement) {
        List<StaticStruct> transfers = new ArrayList<>();
        for (PublishedTransfer t : settlement.transfers()) {
            transfers.add(SettlementAbi.transfer(t.intentIdA(), t.intentIdB(), t.userA(), t.userB(),
                    t.tokenA(), t.tokenB(), t.amountA().handle(), t.amountB().handle()));
        }
        List<DynamicBytes> signatures = new ArrayList<>();
        for (CommitteeSignature sig : settlement.signatures()) {
            signatures.add(new DynamicBytes(Numeric.hexStringToByteArray(sig.signature())));
        }
        List<Type> params = Arrays.asList(
                new Bytes32(HexUtil.bytes32(settlement.batchId())),
                new Bytes32(HexUtil.bytes32(settlement.settlementHash())),
                SettlementAbi.transferArray(transfers),
                SettlementAbi.netSwapArray(settlement.netSwaps()),
                new DynamicArray<>(DynamicBytes.class, signatures)
        );
        return SETTLE_BATCH_SELECTOR + Numeric.cleanHexPrefix(FunctionEncoder.encodeConstructor(params));
    }

    @Override
    public boolean isCommitteeMemberSelected(String batchId, String operatorAddress) {
        Function fn = new Function(
                "isCommitteeMemberSelected",
                Arrays.asList(new Bytes32(HexUtil.bytes32(batchId)), new Address(operatorAddress)),
                Collections.singletonList(new TypeReference<Bool>() {})
        );
        return ((Bool) callAndDecode(fn, 1).get(0)).getValue();
    }

    @SuppressWarnings("rawtypes")
    private List<Type> callAndDecode(Function fn, int expectedOutputs) {
        String data = FunctionEncoder.encode(fn);
        String result = retrier.call(fn.getName(), NetworkTransientException.class, () -> {
            try {
                EthCall resp = web3j.ethCall(
                        Transaction.createEthCallTransaction(operator.address(), contractAddress, data),
                        DefaultBlockParameterName.LATEST).send();
                if (resp.isReverted()) {
                    throw new LedgerRejectedException(fn.getName() + " reverted: " + resp.getRevertReason());
                }
                if (resp.hasError()) {
                    throw new NetworkTransientException(fn.getName() + " failed: " + resp.getError().getMessage());
                }
                return resp.getValue();
            } catch (IOException e) {
                throw new NetworkTransientException(fn.getName() + " failed: " + e.getMessage(), e);
            }
        });
        List<Type> decoded = FunctionReturnDecoder.decode(result, fn.getOutputParameters());
        if (decoded.size() != expectedOutputs) {
            throw new NetworkTransientException("Unexpected " + fn.getName() + " outputs=" + decoded.size()
                    + ", expected=" + expectedOutputs);
        }
        return decoded;
    }

    private TransactionReceipt sendTransaction(String function, String data) {
        String txHash;
        try {
            synchronized (broadcastLock) {
                BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
                EthSendTransaction sent = txManager.sendTransaction(gasPrice, gasLimit, contractAddress, data, BigInteger.ZERO);
                if (sent.hasError()) {
                    throw new LedgerRejectedException(function + " rejected: " + sent.getError().getMessage());
                }
                txHash = sent.getTransactionHash();
            }
        } catch (IOException e) {
            throw new NetworkTransientException(function + " broadcast failed: " + e.getMessage(), e);
        }

        TransactionReceipt receipt = waitForReceipt(txHash,
                Duration.ofSeconds(polling.getReceiptTimeoutSeconds()),
                Duration.ofMillis(polling.getReceiptPollInitialMs()),
                Duration.ofMillis(polling.getReceiptPollMaxMs()));
        if (receipt == null) {
            throw new NetworkTransientException(function + " failed: no receipt after timeout. tx=" + txHash);
        }
        if (!receipt.isStatusOK()) {
            throw new LedgerRejectedException(function + " reverted on-chain: " + receipt.getRevertReason() + ". tx=" + txHash);
        }
        log.info("{} SUCCESS: tx={}, block={}", function, txHash, receipt.getBlockNumber());
        return receipt;
    }

    private TransactionReceipt waitForReceipt(String txHash, Duration timeout, Duration pollInitial, Duration pollMax) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        long sleepMs = Math.max(100, pollInitial.toMillis());
        long maxSleepMs = Math.max(sleepMs, pollMax.toMillis());
        while (System.currentTimeMillis() < deadline) {
            try {
                Optional<TransactionReceipt> receipt = web3j.ethGetTransactionReceipt(txHash).send().getTransactionReceipt();
                if (receipt.isPresent()) return receipt.get();
            } catch (IOException e) {
                log.debug("Receipt not available yet for {}: {}", txHash, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, 150);
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return null;
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
        return null;
    }
}
