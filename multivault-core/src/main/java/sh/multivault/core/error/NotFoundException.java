// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when a wallet or transaction id is unknown.
 */
public final class NotFoundException extends MultivaultException {

    private final String id;

    public NotFoundException(final String what, final String id) {
        super(ErrorKind.NOT_FOUND, what + " not found: " + id);
        this.id = id;
    }

    public static NotFoundException wallet(final String walletId) {
        return new NotFoundException("Wallet", walletId);
    }

    public static NotFoundException transaction(final String transactionId) {
        return new NotFoundException("Transaction", transactionId);
    }

    public String id() {
        return id;
    }
}
