// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC response from a Bitcoin Core node.
 *
 * <p>
 * Holds either a result or an error. Bitcoin Core speaks JSON-RPC 1.0, so both members are
 * present and the unused one is {@code null}; use {@link #hasError()} to tell them apart.
 * Fractional numbers inside the result are {@link java.math.BigDecimal}, keeping BTC amounts
 * exact.
 *
 * @param jsonrpc protocol version, absent for 1.0 responses
 * @param result  result value, or {@code null} on error
 * @param error   error object, or {@code null} on success
 * @param id      id of the request answered
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        @Nullable String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * @throws IllegalArgumentException if the result is not a JSON object
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        throw new IllegalArgumentException("Result is not an object: " + result);
    }

    /**
     * Converts the result to {@code type} using Jackson.
     */
    public <T> @Nullable T resultAs(final Class<T> type) {
        if (result == null) {
            return null;
        }
        return MAPPER.convertValue(result, type);
    }
}
