// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import org.jspecify.annotations.Nullable;
import sh.multivault.core.error.ExternalServiceException;

/**
 * Thrown when a JSON-RPC call to the Bitcoin node fails, either at the transport or because
 * the node answered with an error object.
 *
 * <p>
 * <strong>Codes used by this client:</strong>
 * <ul>
 * <li><strong>-32700</strong>: request or response could not be (de)serialized</li>
 * <li><strong>-32000</strong>: network error or timeout</li>
 * <li><strong>-32001</strong>: HTTP error status without a JSON-RPC error body</li>
 * </ul>
 * Other codes are passed through from the node, for example {@code -26} (transaction
 * rejected) or {@code -5} (unknown transaction).
 */
public final class RpcException extends ExternalServiceException {

    /** Bitcoin Core: transaction rejected by mempool policy. */
    public static final int RPC_VERIFY_REJECTED = -26;

    /** Bitcoin Core: transaction already in the chain. */
    public static final int RPC_VERIFY_ALREADY_IN_CHAIN = -27;

    private final int code;
    private final @Nullable String data;
    private final @Nullable Long requestId;

    public RpcException(
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable Long requestId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final @Nullable String data, final @Nullable Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable Long requestId() {
        return requestId;
    }

    public boolean isRejected() {
        return code == RPC_VERIFY_REJECTED || code == RPC_VERIFY_ALREADY_IN_CHAIN;
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + ", data=" + data
                + ", requestId=" + requestId + "}";
    }

    private static String augmentMessage(final String message, final @Nullable Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
