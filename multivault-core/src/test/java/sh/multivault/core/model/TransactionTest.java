// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import sh.multivault.core.error.StateException;

class TransactionTest {

    private static final String NOW = "2026-01-01T00:00:00Z";

    private static Transaction pending() {
        return Transaction.pending("tx1", "w1", "bcrt1qrecipient", 100_000L, 1_900L, 898_100L,
                "00", 1, 2, NOW, "rent");
    }

    @Test
    void pendingStartsEmpty() {
        final Transaction tx = pending();

        assertEquals(TransactionStatus.PENDING, tx.status());
        assertEquals(0, tx.signaturesReceived());
        assertEquals(2, tx.signaturesRemaining());
        assertTrue(tx.signatures().isEmpty());
        assertNull(tx.signedTransaction());
    }

    @Test
    void signaturesAccumulateInSubmissionOrder() {
        final Transaction tx = pending()
                .withSignature("bb", List.of("30aa"), "01")
                .withSignature("aa", List.of("30bb"), "02");

        assertEquals(List.of("bb", "aa"), List.copyOf(tx.signatures().keySet()));
        assertEquals(2, tx.signaturesReceived());
        assertEquals("02", tx.template());
        assertTrue(tx.hasSigned("aa"));
    }

    @Test
    void fullLifecycleSetsFieldsAtEachStep() {
        final Transaction signed = pending()
                .withSignature("aa", List.of("30"), "01")
                .withSignature("bb", List.of("30"), "01")
                .finalized("0200");
        assertEquals(TransactionStatus.ALL_SIGNED, signed.status());
        assertEquals("0200", signed.signedTransaction());
        assertNull(signed.txHash());

        final Transaction broadcast = signed.broadcasted("f00d", NOW);
        assertEquals(TransactionStatus.BROADCASTED, broadcast.status());
        assertEquals("f00d", broadcast.txHash());
        assertEquals(NOW, broadcast.broadcastTime());

        final Transaction confirmed = broadcast.confirmed();
        assertEquals(TransactionStatus.CONFIRMED, confirmed.status());
        assertEquals("0200", confirmed.signedTransaction());
    }

    @Test
    void rejectsSignatureAfterPending() {
        final Transaction cancelled = pending().cancelled();

        assertThrows(StateException.class, () -> cancelled.withSignature("aa", List.of("30"), "01"));
    }

    @Test
    void cannotCancelOnceSigned() {
        final Transaction signed = pending().withSignature("aa", List.of("30"), "01").finalized("0200");

        assertThrows(StateException.class, signed::cancelled);
    }

    @Test
    void constructorEnforcesInvariants() {
        assertThrows(IllegalArgumentException.class, () -> new Transaction("tx", "w", "addr", 1, 1, 0,
                TransactionStatus.PENDING, "00", 1, 0, Map.of(), 0, null, NOW, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new Transaction("tx", "w", "addr", 1, 1, 0,
                TransactionStatus.PENDING, "00", 1, 2, Map.of("aa", List.of("30")), 2, null, NOW, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new Transaction("tx", "w", "addr", 1, 1, 0,
                TransactionStatus.ALL_SIGNED, "00", 1, 1, Map.of("aa", List.of("30")), 1, null, NOW, null, null,
                null));
        assertThrows(IllegalArgumentException.class, () -> new Transaction("tx", "w", "addr", 1, 1, 0,
                TransactionStatus.BROADCASTED, "00", 1, 1, Map.of("aa", List.of("30")), 1, "02", NOW, null, null,
                null));
    }
}
