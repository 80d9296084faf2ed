// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a submitted signature is malformed, made by a key outside the wallet, or does
 * not verify against the input's digest.
 */
public final class InvalidSignatureException extends MultivaultException {

    private final @Nullable Integer inputIndex;

    public InvalidSignatureException(final String message) {
        super(ErrorKind.INVALID_SIGNATURE, message);
        this.inputIndex = null;
    }

    public InvalidSignatureException(final int inputIndex, final String message) {
        super(ErrorKind.INVALID_SIGNATURE, "Input " + inputIndex + ": " + message);
        this.inputIndex = inputIndex;
    }

    public InvalidSignatureException(final int inputIndex, final String message, final Throwable cause) {
        super(ErrorKind.INVALID_SIGNATURE, "Input " + inputIndex + ": " + message, cause);
        this.inputIndex = inputIndex;
    }

    /**
     * @return the rejected input index, or {@code null} when the whole submission was rejected
     */
    public @Nullable Integer inputIndex() {
        return inputIndex;
    }
}
