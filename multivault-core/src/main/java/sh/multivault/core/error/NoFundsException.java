// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when the wallet address has no spendable outputs.
 */
public final class NoFundsException extends FundsException {

    public NoFundsException(final String address) {
        super(ErrorKind.NO_FUNDS, "No spendable outputs available for " + address);
    }
}
