package dao.fhe.settle.service;

import dao.fhe.settle.cipher.MockThresholdCipherService;
import dao.fhe.settle.codec.EncryptedValueCodec;
import dao.fhe.settle.config.BatchProperties;
import dao.fhe.settle.config.ConsensusProperties;
import dao.fhe.settle.ledger.IntentSubmission;
import dao.fhe.settle.ledger.LocalIntentStore;
import dao.fhe.settle.ledger.ManualBlockClock;
import dao.fhe.settle.model.EncryptedValue;
import dao.fhe.settle.model.Intent;
import dao.fhe.settle.repository.InMemoryBatchRepository;
import dao.fhe.settle.repository.InMemoryIntentRepository;
import dao.fhe.settle.util.BackoffRetrier;
import org.springframework.web.client.RestTemplate;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Local-ledger engine wired by hand, without Spring.
 */
class EngineFixture {

    static final long START_SECONDS = 1_700_000_000L;
    static final String POOL = "0x" + "01".repeat(32);
    static final String USDC = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
    static final String USDT = "0xdAC17F958D2ee523a2206206994597C13D831ec7";
    static final String WETH = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";
    static final String ALICE = "0x1111111111111111111111111111111111111111";
    static final String BOB = "0x2222222222222222222222222222222222222222";
    static final String CAROL = "0x3333333333333333333333333333333333333333";

    final ManualBlockClock blockClock = new ManualBlockClock(1, START_SECONDS);
    final BatchProperties batchProps = new BatchProperties();
    final ConsensusProperties consensusProps = new ConsensusProperties();
    final OperatorIdentity operator;
    final InMemoryBatchRepository batchRepository = new InMemoryBatchRepository();
    final InMemoryIntentRepository intentRepository = new InMemoryIntentRepository();
    final BatchAccumulator accumulator;
    final LocalIntentStore store;
    final MockThresholdCipherService cipher = new MockThresholdCipherService();
    final EncryptedValueCodec codec = new EncryptedValueCodec(cipher);
    final SettlementHasher hasher = new SettlementHasher();
    final ConsensusAggregator aggregator;
    final SettlementPublisher publisher;
    final BatchSettlementService settlementService;

    EngineFixture() {
        this(100, 1, List.of());
    }

    EngineFixture(int maxIntents, int minAttestations, List<String> committee) {
        this(maxIntents, minAttestations, committee, operatorKey(1));
    }

    EngineFixture(int maxIntents, int minAttestations, List<String> committee, ECKeyPair operatorKey) {
        batchProps.setMaxIntents(maxIntents);
        batchProps.setBlockInterval(5);
        batchProps.setMaxIdleSeconds(60);
        consensusProps.setMinAttestations(minAttestations);
        consensusProps.setCommittee(committee);
        operator = new OperatorIdentity(operatorKey);
        accumulator = new BatchAccumulator(batchRepository, intentRepository, batchProps, blockClock, operator);
        store = new LocalIntentStore(accumulator, batchRepository, intentRepository, blockClock, consensusProps, operator);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(START_SECONDS), ZoneOffset.UTC);
        aggregator = new ConsensusAggregator(store, hasher, operator, consensusProps, clock);
        publisher = new SettlementPublisher(store, aggregator, hasher, cipher);
        PeerAttestationAnnouncer announcer = new PeerAttestationAnnouncer(new RestTemplate(), consensusProps);
        settlementService = new BatchSettlementService(store, codec, new OrderMatcher(), aggregator, publisher,
                announcer, BackoffRetrier.immediate(2), clock);
    }

    static ECKeyPair operatorKey(long seed) {
        return ECKeyPair.create(BigInteger.valueOf(1_000_003L * seed));
    }

    String submit(String user, String tokenIn, String tokenOut, long amount) {
        return submit(user, tokenIn, tokenOut, cipher.encrypt(BigInteger.valueOf(amount), Intent.AMOUNT_TAG),
                blockClock.nowSeconds() + 3600);
    }

    String submit(String user, String tokenIn, String tokenOut, EncryptedValue amount, long deadline) {
        return store.submitIntent(new IntentSubmission(POOL, user, tokenIn, tokenOut, amount, deadline));
    }

    String openBatchId() {
        return accumulator.getOpenBatch(POOL).orElseThrow().getId();
    }
}
