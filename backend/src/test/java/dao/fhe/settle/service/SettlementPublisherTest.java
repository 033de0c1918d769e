package dao.fhe.settle.service;

import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.exception.QuorumNotMetException;
import dao.fhe.settle.ledger.IntentStore;
import dao.fhe.settle.ledger.PublishedSettlement;
import dao.fhe.settle.ledger.SettlementReceipt;
import dao.fhe.settle.model.BatchState;
import dao.fhe.settle.model.CommitteeSignature;
import dao.fhe.settle.model.InternalizedTransfer;
import dao.fhe.settle.model.Settlement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static dao.fhe.settle.service.EngineFixture.ALICE;
import static dao.fhe.settle.service.EngineFixture.BOB;
import static dao.fhe.settle.service.EngineFixture.USDC;
import static dao.fhe.settle.service.EngineFixture.USDT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettlementPublisherTest {

    private EngineFixture f;
    private String batchId;
    private Settlement settlement;
    private List<CommitteeSignature> signatures;

    @BeforeEach
    void setUp() {
        f = new EngineFixture();
        String a = f.submit(ALICE, USDC, USDT, 500);
        String b = f.submit(BOB, USDT, USDC, 500);
        batchId = f.openBatchId();
        f.accumulator.adminFinalize(batchId, f.operator.address());

        InternalizedTransfer transfer = new InternalizedTransfer(a, b, ALICE, BOB, USDC, USDT,
                BigInteger.valueOf(500), BigInteger.valueOf(500));
        settlement = new Settlement(batchId, List.of(transfer), List.of(), List.of());
        signatures = List.of(f.operator.sign(f.hasher.hash(settlement)));
    }

    @Test
    @DisplayName("Publishes once, then reports the batch as already attempted")
    void publishesOnce() {
        PublishAck ack = f.publisher.publish(settlement, signatures);

        assertEquals(PublishAck.Status.SUBMITTED, ack.status());
        assertNotNull(ack.txHash());
        assertEquals(BatchState.SETTLED, f.batchRepository.findById(batchId).orElseThrow().getState());
        assertEquals(PublishAck.Status.ALREADY_ATTEMPTED, f.publisher.publish(settlement, signatures).status());

        PublishedSettlement stored = f.store.findSettlement(batchId).orElseThrow();
        assertEquals(f.hasher.hash(settlement), stored.settlementHash());
        assertEquals(BigInteger.valueOf(500), f.cipher.decrypt(stored.transfers().get(0).amountA()));
    }

    @Test
    void freshPublisherSeesSettledBatch() {
        f.publisher.publish(settlement, signatures);
        SettlementPublisher restarted = new SettlementPublisher(f.store, f.aggregator, f.hasher, f.cipher);

        assertEquals(PublishAck.Status.ALREADY_SETTLED, restarted.publish(settlement, signatures).status());
    }

    @Test
    void insufficientSignaturesAreRejected() {
        CommitteeSignature forged = new CommitteeSignature(f.operator.address(), "0x" + "11".repeat(65));

        QuorumNotMetException e = assertThrows(QuorumNotMetException.class,
                () -> f.publisher.publish(settlement, List.of(forged)));
        assertEquals(0, e.getValidSignatures());
        assertFalse(f.publisher.wasAttempted(batchId));
    }

    @Test
    @DisplayName("A single ledger rejection is retried after refreshing batch state")
    void retriesOnceAfterRejection() {
        IntentStore ledger = mockLedger();
        when(ledger.submitSettlement(any()))
                .thenThrow(new LedgerRejectedException("nonce too low"))
                .thenReturn(new SettlementReceipt(batchId, "0xfeed", 7));
        SettlementPublisher publisher = new SettlementPublisher(ledger, f.aggregator, f.hasher, f.cipher);

        PublishAck ack = publisher.publish(settlement, signatures);

        assertEquals(PublishAck.Status.SUBMITTED, ack.status());
        assertEquals("0xfeed", ack.txHash());
        verify(ledger, times(2)).submitSettlement(any());
    }

    @Test
    void secondRejectionPropagatesAndAllowsRetry() {
        IntentStore ledger = mockLedger();
        when(ledger.submitSettlement(any())).thenThrow(new LedgerRejectedException("reverted"));
        SettlementPublisher publisher = new SettlementPublisher(ledger, f.aggregator, f.hasher, f.cipher);

        assertThrows(LedgerRejectedException.class, () -> publisher.publish(settlement, signatures));
        assertFalse(publisher.wasAttempted(batchId));
        assertThrows(LedgerRejectedException.class, () -> publisher.publish(settlement, signatures));
        verify(ledger, times(4)).submitSettlement(any());
    }

    private IntentStore mockLedger() {
        IntentStore ledger = mock(IntentStore.class);
        when(ledger.getBatch(batchId)).thenAnswer(inv -> f.store.getBatch(batchId));
        return ledger;
    }
}
