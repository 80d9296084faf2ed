// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.List;

/**
 * Transactions of one wallet still collecting signatures, oldest first.
 */
public record PendingTransactions(String walletId, String address, List<TransactionSummary> transactions) {

    public PendingTransactions {
        transactions = List.copyOf(transactions);
    }
}
