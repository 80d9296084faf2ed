// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

/**
 * Result of a signature submission.
 *
 * @param transactionId       the transaction signed
 * @param status              status after the submission
 * @param signaturesReceived  distinct signers so far
 * @param signaturesRemaining signers still needed to reach the threshold
 */
public record SignatureProgress(
        String transactionId, TransactionStatus status, int signaturesReceived, int signaturesRemaining) {

    public static SignatureProgress of(final Transaction tx) {
        return new SignatureProgress(
                tx.transactionId(), tx.status(), tx.signaturesReceived(), tx.signaturesRemaining());
    }
}
