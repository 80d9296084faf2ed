// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import sh.multivault.core.error.ExternalServiceException;

/**
 * Thrown when the HSM vault is unreachable, times out or answers without the expected field.
 */
public final class HsmException extends ExternalServiceException {

    private final int statusCode;

    public HsmException(final String message, final int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public HsmException(final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return HTTP status of the vault's response, or -1 when none was received
     */
    public int statusCode() {
        return statusCode;
    }
}
