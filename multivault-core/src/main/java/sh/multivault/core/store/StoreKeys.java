// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

/**
 * Record key namespaces.
 */
public final class StoreKeys {

    public static final String WALLET_PREFIX = "wallet:";
    public static final String TRANSACTION_PREFIX = "tx:";

    private StoreKeys() {
    }

    public static String wallet(final String walletId) {
        return WALLET_PREFIX + walletId;
    }

    public static String transaction(final String transactionId) {
        return TRANSACTION_PREFIX + transactionId;
    }

    /**
     * Strips the namespace prefix from a stored key.
     */
    public static String idOf(final String key) {
        final int colon = key.indexOf(':');
        return colon < 0 ? key : key.substring(colon + 1);
    }
}
