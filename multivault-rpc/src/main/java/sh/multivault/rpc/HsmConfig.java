// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Location of a remote HSM signing vault.
 *
 * @param vaultUrl scheme and host, e.g. {@code https://hsm.internal}
 * @param port     vault port
 * @param timeout  per-request timeout, defaults to 30 seconds
 */
public record HsmConfig(String vaultUrl, int port, Duration timeout) {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public HsmConfig {
        Objects.requireNonNull(vaultUrl, "vaultUrl");
        final URI uri = URI.create(vaultUrl);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid HSM vault URL: " + vaultUrl);
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("Invalid HSM vault port: " + port);
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static HsmConfig of(final String vaultUrl, final int port) {
        return new HsmConfig(vaultUrl, port, DEFAULT_TIMEOUT);
    }

    URI endpoint(final String path) {
        return URI.create(vaultUrl + ":" + port + path);
    }
}
