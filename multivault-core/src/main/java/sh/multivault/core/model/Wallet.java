// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable M-of-N multisig wallet record. Holds public material only.
 *
 * @param walletId     deterministic identifier derived from the ordered participant keys
 * @param address      funding address of the spending script
 * @param redeemScript serialized spending (witness) script, lowercase hex
 * @param m            signature threshold
 * @param n            number of participants
 * @param name         descriptive name, may be empty
 * @param creationTime ISO-8601 instant
 * @param participants exactly {@code n} participants in derivation order
 */
public record Wallet(
        String walletId,
        String address,
        String redeemScript,
        int m,
        int n,
        String name,
        String creationTime,
        List<Participant> participants) {

    public Wallet {
        Objects.requireNonNull(walletId, "walletId");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(redeemScript, "redeemScript");
        Objects.requireNonNull(creationTime, "creationTime");
        if (m <= 0 || m > n) {
            throw new IllegalArgumentException("invalid policy " + m + "-of-" + n);
        }
        participants = List.copyOf(participants);
        if (participants.size() != n) {
            throw new IllegalArgumentException("expected " + n + " participants, got " + participants.size());
        }
        name = name == null ? "" : name;
    }

    public List<String> publicKeys() {
        return participants.stream().map(Participant::publicKey).toList();
    }
}
