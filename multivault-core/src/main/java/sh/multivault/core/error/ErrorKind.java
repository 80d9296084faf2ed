// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Machine-readable classification carried by every {@link MultivaultException}.
 *
 * <p>
 * Host request layers map kinds to their own response codes. Only
 * {@link #EXTERNAL_SERVICE} represents a fault of the system itself; every other kind is
 * the outcome of a caller request.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    STATE,
    DUPLICATE_SIGNER,
    INVALID_SIGNATURE,
    INSUFFICIENT_FUNDS,
    NO_FUNDS,
    CONFLICT,
    EXTERNAL_SERVICE
}
