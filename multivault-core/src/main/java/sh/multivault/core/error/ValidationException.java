// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when caller input has the wrong shape or is out of bounds. Never a system fault.
 */
public final class ValidationException extends MultivaultException {

    public ValidationException(final String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
