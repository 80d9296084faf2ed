// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.error;

/**
 * Thrown when a public key submits signatures for a transaction it has already signed.
 */
public final class DuplicateSignerException extends MultivaultException {

    private final String publicKey;

    public DuplicateSignerException(final String transactionId, final String publicKey) {
        super(ErrorKind.DUPLICATE_SIGNER,
                "Public key " + publicKey + " has already signed transaction " + transactionId);
        this.publicKey = publicKey;
    }

    public String publicKey() {
        return publicKey;
    }
}
