// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when a network, signing or broadcast collaborator fails or times out.
 * <p>
 * Non-sealed so collaborator implementations can report transport-specific detail
 * (JSON-RPC error codes, HSM status) through their own subclasses. A record is never left
 * partially updated when this is thrown.
 *
 * @since 0.1.0
 */
public non-sealed class ExternalServiceException extends MultivaultException {

    public ExternalServiceException(final String message) {
        super(ErrorKind.EXTERNAL_SERVICE, message);
    }

    public ExternalServiceException(final String message, final Throwable cause) {
        super(ErrorKind.EXTERNAL_SERVICE, message, cause);
    }

    public boolean isTimeout() {
        Throwable t = this;
        while (t != null) {
            if (t instanceof java.net.http.HttpTimeoutException
                    || t instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            final String msg = t.getMessage();
            if (msg != null && msg.toLowerCase().contains("timed out")) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }
}
