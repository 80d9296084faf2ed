// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when the available inputs do not cover the requested amount plus the network fee.
 */
public final class InsufficientFundsException extends FundsException {

    private final long available;
    private final long required;

    public InsufficientFundsException(final long available, final long required) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
                "Insufficient funds. Available: " + available + ", required (amount + fee): " + required);
        this.available = available;
        this.required = required;
    }

    public long available() {
        return available;
    }

    public long required() {
        return required;
    }
}
