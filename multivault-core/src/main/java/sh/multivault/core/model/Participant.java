// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.Objects;

/**
 * One co-signer of a multisig wallet.
 *
 * @param publicKey compressed secp256k1 public key, lowercase hex
 * @param userId    host-application user identifier, empty when not supplied
 */
public record Participant(String publicKey, String userId) {

    public Participant {
        Objects.requireNonNull(publicKey, "publicKey");
        userId = userId == null ? "" : userId;
    }

    public static Participant of(final String publicKey) {
        return new Participant(publicKey, "");
    }
}
