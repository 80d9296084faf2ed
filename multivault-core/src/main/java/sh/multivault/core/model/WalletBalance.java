// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

/**
 * Spendable balance at a wallet's funding address.
 *
 * @param confirmedBalance sum of spendable outputs in satoshis
 * @param utxoCount        number of spendable outputs
 */
public record WalletBalance(String walletId, String address, long confirmedBalance, int utxoCount) {
}
