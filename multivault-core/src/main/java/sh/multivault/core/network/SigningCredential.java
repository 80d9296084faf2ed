// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.network;

import java.util.Objects;

/**
 * Identity of a key held by the remote signing service. Carries no key material.
 *
 * @param userId owner of the key
 * @param label  key label inside the signing service
 */
public record SigningCredential(String userId, String label) {

    public SigningCredential {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(label, "label");
    }

    @Override
    public String toString() {
        return "SigningCredential[userId=" + userId + ", label=***]";
    }
}
