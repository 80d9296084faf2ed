// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.Objects;

/**
 * Unspent output usable as a funding input.
 *
 * @param txid   funding transaction id, big-endian hex as shown by block explorers
 * @param vout   output index within the funding transaction
 * @param amount value in satoshis
 */
public record Utxo(String txid, int vout, long amount) {

    public Utxo {
        Objects.requireNonNull(txid, "txid");
        if (vout < 0) {
            throw new IllegalArgumentException("vout must be non-negative: " + vout);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be non-negative: " + amount);
        }
    }
}
