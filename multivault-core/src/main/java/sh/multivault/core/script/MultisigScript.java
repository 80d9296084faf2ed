// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

import java.util.Objects;

/**
 * Funding address and spending script of a multisig policy.
 *
 * @param address      receiving address
 * @param redeemScript serialized spending script, lowercase hex
 */
public record MultisigScript(String address, String redeemScript) {

    public MultisigScript {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(redeemScript, "redeemScript");
    }
}
