// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.List;

/**
 * The per-input digests a co-signer must sign, in input order.
 *
 * @param transactionId the pending transaction
 * @param digests       32-byte digests, lowercase hex
 */
public record UnsignedDigests(String transactionId, List<String> digests) {

    public UnsignedDigests {
        digests = List.copyOf(digests);
    }
}
