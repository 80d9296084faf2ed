// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.model;

import java.util.List;

/**
 * One page of a wallet's non-pending transactions, newest first.
 *
 * @param walletId     the wallet
 * @param address      the wallet's funding address
 * @param transactions the page contents
 * @param page         1-based page number
 * @param pageSize     maximum entries per page
 * @param totalCount   non-pending transactions across all pages
 */
public record TransactionHistory(
        String walletId,
        String address,
        List<TransactionSummary> transactions,
        int page,
        int pageSize,
        int totalCount) {

    public TransactionHistory {
        transactions = List.copyOf(transactions);
    }

    public boolean hasNextPage() {
        return (long) page * pageSize < totalCount;
    }
}
