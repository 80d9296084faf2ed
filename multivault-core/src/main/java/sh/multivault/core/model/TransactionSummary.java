// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import org.jspecify.annotations.Nullable;

/**
 * Public view of a transaction record. Omits the template, signatures and raw transaction.
 */
public record TransactionSummary(
        String transactionId,
        String walletId,
        String recipientAddress,
        long amount,
        long fee,
        TransactionStatus status,
        int requiredSignatures,
        int signaturesReceived,
        String initiatedTime,
        @Nullable String broadcastTime,
        @Nullable String txHash,
        @Nullable String note) {

    public static TransactionSummary of(final Transaction tx) {
        return new TransactionSummary(
                tx.transactionId(),
                tx.walletId(),
                tx.recipientAddress(),
                tx.amount(),
                tx.fee(),
                tx.status(),
                tx.requiredSignatures(),
                tx.signaturesReceived(),
                tx.initiatedTime(),
                tx.broadcastTime(),
                tx.txHash(),
                tx.note());
    }
}
