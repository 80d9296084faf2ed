// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import sh.multivault.core.model.Transaction;
import sh.multivault.core.model.Wallet;
import sh.multivault.core.network.ExternalCalls;

/**
 * Typed access to wallet and transaction records in a {@link KeyValueStore}.
 *
 * <p>
 * Store failures surface as {@link sh.multivault.core.error.ExternalServiceException}.
 */
public final class RecordStore {

    private final KeyValueStore store;
    private final RecordCodec codec;

    public RecordStore(final KeyValueStore store) {
        this(store, new RecordCodec());
    }

    public RecordStore(final KeyValueStore store, final RecordCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Optional<Wallet> wallet(final String walletId) {
        return read(StoreKeys.wallet(walletId), Wallet.class);
    }

    public boolean hasWallet(final String walletId) {
        return wallet(walletId).isPresent();
    }

    public void putWallet(final Wallet wallet) {
        write(StoreKeys.wallet(wallet.walletId()), wallet);
    }

    public Optional<Transaction> transaction(final String transactionId) {
        return read(StoreKeys.transaction(transactionId), Transaction.class);
    }

    public void putTransaction(final Transaction transaction) {
        write(StoreKeys.transaction(transaction.transactionId()), transaction);
    }

    /**
     * Every transaction record belonging to {@code walletId}, in key order.
     */
    public List<Transaction> transactionsOf(final String walletId) {
        final List<String> keys = ExternalCalls.call("store scan",
                () -> store.getKeysWithPrefix(StoreKeys.TRANSACTION_PREFIX));
        final List<Transaction> result = new ArrayList<>();
        for (String key : keys) {
            read(key, Transaction.class)
                    .filter(tx -> tx.walletId().equals(walletId))
                    .ifPresent(result::add);
        }
        return result;
    }

    private <T> Optional<T> read(final String key, final Class<T> type) {
        final Optional<byte[]> bytes = ExternalCalls.call("store get", () -> store.get(key));
        return bytes.map(value -> codec.decode(value, type));
    }

    private void write(final String key, final Object record) {
        final byte[] bytes = codec.encode(record);
        ExternalCalls.run("store put", () -> store.put(key, bytes));
    }
}
