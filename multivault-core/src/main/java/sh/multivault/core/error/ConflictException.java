// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when a wallet or transaction with the same derived identifier is already recorded.
 */
public final class ConflictException extends MultivaultException {

    public ConflictException(final String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public ConflictException(final String message, final Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
