// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

import sh.multivault.core.model.TransactionStatus;

/**
 * Thrown when an operation is not legal in the transaction's current lifecycle state.
 */
public final class StateException extends MultivaultException {

    private final TransactionStatus current;
    private final TransactionStatus requested;

    public StateException(final TransactionStatus current, final TransactionStatus requested) {
        super(ErrorKind.STATE,
                "Illegal transition from " + current.wireName() + " to " + requested.wireName());
        this.current = current;
        this.requested = requested;
    }

    public StateException(
            final TransactionStatus current, final TransactionStatus requested, final String message) {
        super(ErrorKind.STATE, message
                + " (current: " + current.wireName() + ", requested: " + requested.wireName() + ")");
        this.current = current;
        this.requested = requested;
    }

    public TransactionStatus current() {
        return current;
    }

    public TransactionStatus requested() {
        return requested;
    }
}
