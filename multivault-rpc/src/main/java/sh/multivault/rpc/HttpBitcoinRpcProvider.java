// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;
import sh.multivault.core.DebugLogger;
import sh.multivault.core.LogFormatter;

/**
 * {@link BitcoinRpcProvider} over HTTP, using JSON-RPC 1.0 as Bitcoin Core expects.
 *
 * <p>
 * Bitcoin Core reports RPC errors with HTTP 500 and a JSON-RPC error body; such responses are
 * turned into {@link RpcException}s carrying the node's error code.
 *
 * <pre>{@code
 * BitcoinRpcProvider provider = HttpBitcoinRpcProvider.builder("http://127.0.0.1:18443")
 *         .basicAuth("user", "pass")
 *         .readTimeout(Duration.ofSeconds(60))
 *         .build();
 * }</pre>
 */
public final class HttpBitcoinRpcProvider implements BitcoinRpcProvider {

    private static final String JSONRPC_VERSION = "1.0";

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = JsonRpcResponse.MAPPER;
    private final AtomicLong ids = new AtomicLong(1L);

    private HttpBitcoinRpcProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final List<?> safeParams = params == null ? List.of() : params;
        final long requestId = ids.getAndIncrement();
        final JsonRpcRequest request =
                new JsonRpcRequest(JSONRPC_VERSION, method, safeParams, String.valueOf(requestId));

        final String payload = serialize(request, requestId);
        DebugLogger.logRpc("[RPC-REQUEST] %s", payload);
        final HttpRequest httpRequest = buildRequest(payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(method, httpRequest, requestId);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        final String body = response.body();
        final boolean ok = response.statusCode() >= 200 && response.statusCode() < 300;
        final JsonRpcResponse rpcResponse = tryParse(body);

        if (rpcResponse != null && rpcResponse.hasError()) {
            final JsonRpcError err = rpcResponse.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new RpcException(err.code(), err.message(), err.data() == null ? null : err.data().toString(),
                    requestId);
        }
        if (!ok) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    method, response.statusCode(), "HTTP " + response.statusCode(), durationMicros));
            throw new RpcException(-32001, "HTTP error for method " + method + ": " + response.statusCode(),
                    body, requestId);
        }
        if (rpcResponse == null) {
            throw new RpcException(-32700, "Unable to parse JSON-RPC response for method " + method, body,
                    requestId);
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return rpcResponse;
    }

    private String serialize(final JsonRpcRequest request, final long requestId) throws RpcException {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(-32700, "Unable to serialize JSON-RPC request for " + request.method(), null,
                    requestId, e);
        }
    }

    private HttpRequest buildRequest(final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.url()))
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        if (config.hasCredentials()) {
            final String pair = config.username() + ":" + (config.password() == null ? "" : config.password());
            builder.header("Authorization",
                    "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8)));
        }
        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private HttpResponse<String> execute(final String method, final HttpRequest request, final long requestId)
            throws RpcException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new RpcException(-32000, "Timed out calling " + method, null, requestId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(-32000, "Network error during JSON-RPC call", null, requestId, e);
        } catch (IOException e) {
            throw new RpcException(-32000, "Network error during JSON-RPC call", null, requestId, e);
        }
    }

    private @Nullable JsonRpcResponse tryParse(final String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable String username;
        private @Nullable String password;

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public Builder basicAuth(final String username, final String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public HttpBitcoinRpcProvider build() {
            return new HttpBitcoinRpcProvider(
                    new RpcConfig(url, connectTimeout, readTimeout, new LinkedHashMap<>(headers), username, password));
        }
    }
}
