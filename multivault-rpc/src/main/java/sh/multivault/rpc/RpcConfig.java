// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Connection settings for a Bitcoin Core JSON-RPC endpoint.
 *
 * @param url            endpoint, e.g. {@code http://127.0.0.1:18443}
 * @param connectTimeout defaults to 10 seconds
 * @param readTimeout    defaults to 30 seconds
 * @param headers        extra HTTP headers sent with every request
 * @param username       basic-auth user, or {@code null} for none
 * @param password       basic-auth password
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers,
        @Nullable String username,
        @Nullable String password) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of(), null, null);
    }

    public boolean hasCredentials() {
        return username != null;
    }

    @Override
    public String toString() {
        return "RpcConfig[url=" + url + ", connectTimeout=" + connectTimeout + ", readTimeout=" + readTimeout
                + ", headers=" + headers.keySet() + ", username=" + username + "]";
    }
}
