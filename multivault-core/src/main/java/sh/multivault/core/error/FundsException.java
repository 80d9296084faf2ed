// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Base class for funding failures while building a transaction.
 */
public sealed class FundsException extends MultivaultException
        permits InsufficientFundsException, NoFundsException {

    public FundsException(final ErrorKind kind, final String message) {
        super(kind, message);
    }
}
