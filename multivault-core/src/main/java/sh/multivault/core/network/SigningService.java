// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.network;

/**
 * Remote signer holding participants' private keys. Private key material never leaves it.
 *
 * @since 0.1.0
 */
public interface SigningService {

    /**
     * Signs a 32-byte digest with the key identified by {@code credential}.
     *
     * @return the ECDSA signature, DER or 64-byte compact
     */
    byte[] sign(byte[] hash, SigningCredential credential);

    /**
     * Compressed public key of the credential's key, lowercase hex.
     */
    String publicKey(SigningCredential credential);
}
