// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.multivault.core.error.StateException;

/**
 * Persisted multisig transaction record.
 *
 * <p>
 * Records are immutable; every lifecycle step produces a new record through one of the
 * transition methods, which route through {@link TransactionStatus#transitionTo}. The
 * canonical constructor enforces the record invariants:
 * <ul>
 * <li>{@code 0 < requiredSignatures}</li>
 * <li>{@code signaturesReceived == signatures.size()}, and at most
 * {@code requiredSignatures} while pending</li>
 * <li>{@code signedTransaction} present exactly when the status has a signed transaction</li>
 * <li>{@code txHash} and {@code broadcastTime} present exactly once broadcast</li>
 * </ul>
 *
 * @param transactionId      fingerprint of the serialized unsigned template
 * @param walletId           owning wallet
 * @param recipientAddress   destination of the primary output
 * @param amount             primary output value in satoshis
 * @param fee                network fee in satoshis
 * @param changeAmount       change returned to the wallet, 0 when no change output exists
 * @param status             lifecycle state
 * @param template           serialized transaction template, lowercase hex
 * @param inputCount         number of funding inputs
 * @param requiredSignatures wallet threshold at initiation
 * @param signatures         per-signer input signatures (hex), keyed by public key in submission order
 * @param signaturesReceived number of distinct signers
 * @param signedTransaction  finalized raw transaction hex
 * @param initiatedTime      ISO-8601 instant of initiation
 * @param broadcastTime      ISO-8601 instant of broadcast
 * @param txHash             network transaction id returned by broadcast
 * @param note               free-form note
 * @since 0.1.0
 */
public record Transaction(
        String transactionId,
        String walletId,
        String recipientAddress,
        long amount,
        long fee,
        long changeAmount,
        TransactionStatus status,
        String template,
        int inputCount,
        int requiredSignatures,
        Map<String, List<String>> signatures,
        int signaturesReceived,
        @Nullable String signedTransaction,
        String initiatedTime,
        @Nullable String broadcastTime,
        @Nullable String txHash,
        @Nullable String note) {

    public Transaction {
        Objects.requireNonNull(transactionId, "transactionId");
        Objects.requireNonNull(walletId, "walletId");
        Objects.requireNonNull(recipientAddress, "recipientAddress");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(initiatedTime, "initiatedTime");
        if (requiredSignatures <= 0) {
            throw new IllegalArgumentException("requiredSignatures must be positive: " + requiredSignatures);
        }
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        if (signatures != null) {
            signatures.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        }
        signatures = Collections.unmodifiableMap(copy);
        if (signaturesReceived != signatures.size()) {
            throw new IllegalArgumentException(
                    "signaturesReceived " + signaturesReceived + " != signers " + signatures.size());
        }
        if (status == TransactionStatus.PENDING && signaturesReceived > requiredSignatures) {
            throw new IllegalArgumentException("pending transaction exceeds its threshold");
        }
        if (status.hasSignedTransaction() != (signedTransaction != null)) {
            throw new IllegalArgumentException("signedTransaction must be present exactly when " + status.wireName()
                    + " follows finalization");
        }
        if (status.hasBroadcast() != (txHash != null && broadcastTime != null)) {
            throw new IllegalArgumentException("txHash and broadcastTime must be present exactly once broadcast");
        }
    }

    /**
     * Creates a fresh pending record with no signatures.
     */
    public static Transaction pending(
            final String transactionId,
            final String walletId,
            final String recipientAddress,
            final long amount,
            final long fee,
            final long changeAmount,
            final String template,
            final int inputCount,
            final int requiredSignatures,
            final String initiatedTime,
            final @Nullable String note) {
        return new Transaction(transactionId, walletId, recipientAddress, amount, fee, changeAmount,
                TransactionStatus.PENDING, template, inputCount, requiredSignatures, Map.of(), 0, null,
                initiatedTime, null, null, note);
    }

    public int signaturesRemaining() {
        return Math.max(0, requiredSignatures - signaturesReceived);
    }

    public boolean hasSigned(final String publicKey) {
        return signatures.containsKey(publicKey);
    }

    /**
     * Records one signer's input signatures together with the updated template. Status stays
     * pending; {@link #finalized} performs the threshold transition.
     */
    public Transaction withSignature(
            final String publicKey, final List<String> inputSignatures, final String updatedTemplate) {
        if (status != TransactionStatus.PENDING) {
            throw new StateException(status, TransactionStatus.ALL_SIGNED,
                    "Signatures are only accepted while pending");
        }
        final Map<String, List<String>> next = new LinkedHashMap<>(signatures);
        next.put(publicKey, inputSignatures);
        return new Transaction(transactionId, walletId, recipientAddress, amount, fee, changeAmount,
                status, updatedTemplate, inputCount, requiredSignatures, next, next.size(), null,
                initiatedTime, null, null, note);
    }

    public Transaction finalized(final String rawTransaction) {
        return new Transaction(transactionId, walletId, recipientAddress, amount, fee, changeAmount,
                status.transitionTo(TransactionStatus.ALL_SIGNED), template, inputCount, requiredSignatures,
                signatures, signaturesReceived, rawTransaction, initiatedTime, null, null, note);
    }

    public Transaction cancelled() {
        return new Transaction(transactionId, walletId, recipientAddress, amount, fee, changeAmount,
                status.transitionTo(TransactionStatus.CANCELLED), template, inputCount, requiredSignatures,
                signatures, signaturesReceived, null, initiatedTime, null, null, note);
    }

    public Transaction broadcasted(final String networkTxHash, final String time) {
        return new Transaction(transactionId, walletId, recipientAddress, amount, fee, changeAmount,
                status.transitionTo(TransactionStatus.BROADCASTED), template, inputCount, requiredSignatures,
                signatures, signaturesReceived, signedTransaction, initiatedTime, time, networkTxHash, note);
    }

    public Transaction confirmed() {
        return new Transaction(transactionId, walletId, recipientAddress, amount, fee, changeAmount,
                status.transitionTo(TransactionStatus.CONFIRMED), template, inputCount, requiredSignatures,
                signatures, signaturesReceived, signedTransaction, initiatedTime, broadcastTime, txHash, note);
    }
}
