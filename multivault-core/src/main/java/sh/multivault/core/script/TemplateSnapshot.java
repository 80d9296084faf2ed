// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.script;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/**
 * Serialized form of a {@link P2wshTemplate}.
 *
 * @param format        snapshot format version
 * @param network       bitcoinj network id the template was built for
 * @param threshold     signatures required per input
 * @param witnessScript multisig witness script, hex
 * @param unsignedTx    unsigned transaction, hex
 * @param inputs        per-input value and partial signatures
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record TemplateSnapshot(
        int format,
        String network,
        int threshold,
        String witnessScript,
        String unsignedTx,
        List<InputSnapshot> inputs) {

    static final int CURRENT_FORMAT = 1;

    /**
     * @param value             spent output value in satoshis
     * @param partialSignatures public key hex to bitcoin-encoded signature hex
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record InputSnapshot(long value, Map<String, String> partialSignatures) {
    }
}
