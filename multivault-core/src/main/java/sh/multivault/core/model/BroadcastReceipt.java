// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

/**
 * Outcome of a successful broadcast.
 *
 * @param transactionId the broadcast record
 * @param status        always {@link TransactionStatus#BROADCASTED}
 * @param txHash        network transaction id
 * @param broadcastTime ISO-8601 instant
 */
public record BroadcastReceipt(
        String transactionId, TransactionStatus status, String txHash, String broadcastTime) {
}
