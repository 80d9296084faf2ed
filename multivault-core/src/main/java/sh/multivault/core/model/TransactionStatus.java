// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import sh.multivault.core.error.StateException;

/**
 * Lifecycle state of a multisig transaction.
 *
 * <pre>
 * PENDING --(threshold reached)--> ALL_SIGNED --(broadcast)--> BROADCASTED --(confirmed)--> CONFIRMED
 * PENDING --(cancel)--> CANCELLED
 * </pre>
 *
 * <p>
 * {@link #CONFIRMED} and {@link #CANCELLED} are terminal. Every other transition is rejected
 * with a {@link StateException} naming both states.
 *
 * @since 0.1.0
 */
public enum TransactionStatus {
    PENDING("pending"),
    ALL_SIGNED("all_signed"),
    BROADCASTED("broadcasted"),
    CONFIRMED("confirmed"),
    CANCELLED("cancelled");

    private final String wireName;

    TransactionStatus(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TransactionStatus fromWireName(final String value) {
        for (TransactionStatus status : values()) {
            if (status.wireName.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transaction status: " + value);
    }

    public boolean canTransitionTo(final TransactionStatus target) {
        return switch (this) {
            case PENDING -> target == ALL_SIGNED || target == CANCELLED;
            case ALL_SIGNED -> target == BROADCASTED;
            case BROADCASTED -> target == CONFIRMED;
            case CONFIRMED, CANCELLED -> false;
        };
    }

    /**
     * Returns {@code target} if the transition is legal.
     *
     * @throws StateException if the transition is not part of the lifecycle
     */
    public TransactionStatus transitionTo(final TransactionStatus target) {
        if (!canTransitionTo(target)) {
            throw new StateException(this, target);
        }
        return target;
    }

    public boolean isTerminal() {
        return this == CONFIRMED || this == CANCELLED;
    }

    /** True once a finalized raw transaction exists. */
    public boolean hasSignedTransaction() {
        return this == ALL_SIGNED || this == BROADCASTED || this == CONFIRMED;
    }

    /** True once the transaction has been handed to the network. */
    public boolean hasBroadcast() {
        return this == BROADCASTED || this == CONFIRMED;
    }
}
