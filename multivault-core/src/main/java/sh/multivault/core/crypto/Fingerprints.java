// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.bitcoinj.core.Base58;
import sh.multivault.primitives.Hex;

/**
 * Deterministic identifiers for wallets and transactions.
 *
 * <p>
 * A fingerprint is {@code Base58(SHA-256(ascii(hex(bytes))))}: the bytes are hex encoded,
 * the ASCII of that text is hashed, and the 32-byte digest is rendered in Base58. The result
 * is short, URL-safe and collision resistant.
 *
 * <p>
 * Wallet ids are order sensitive: the participant keys are joined in the order supplied,
 * so the same key set in a different order yields a different wallet id.
 *
 * @since 0.1.0
 */
public final class Fingerprints {

    /** Separator between public keys in the key fingerprint input. */
    public static final String KEY_SEPARATOR = "-";

    private Fingerprints() {
    }

    public static String fingerprint(final byte[] data) {
        Objects.requireNonNull(data, "data");
        final byte[] hexText = Hex.encodeNoPrefix(data).getBytes(StandardCharsets.US_ASCII);
        return Base58.encode(Sha256.hash(hexText));
    }

    public static String fingerprint(final String text) {
        return fingerprint(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Fingerprint of the public keys in the order given.
     */
    public static String keyFingerprint(final List<String> publicKeys) {
        if (publicKeys.isEmpty()) {
            throw new IllegalArgumentException("at least one public key is required");
        }
        return fingerprint(String.join(KEY_SEPARATOR, publicKeys));
    }

    /**
     * Wallet id derived from a key fingerprint and a fixed domain-separation suffix.
     */
    public static String walletId(final String keyFingerprint, final String domain) {
        return fingerprint(keyFingerprint + domain);
    }

    public static String walletId(final List<String> publicKeys, final String domain) {
        return walletId(keyFingerprint(publicKeys), domain);
    }

    /**
     * Transaction id derived from the serialized unsigned template.
     */
    public static String transactionId(final byte[] serializedTemplate) {
        return fingerprint(serializedTemplate);
    }
}
