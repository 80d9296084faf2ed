// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import static sh.multivault.core.AnsiColors.*;

/**
 * Log formatter producing the bracketed, colored lines written by {@link DebugLogger}.
 *
 * <p>
 * Status symbols (✓ ✗ ○) mark success, failure and waiting states. Long identifiers
 * (wallet IDs, public keys, transaction hashes) are shortened to {@code 02ab12...ef09}.
 *
 * <pre>{@code
 * DebugLogger.logTx(LogFormatter.formatTxSign(txId, publicKey, 1, 2));
 * // Output: [TX-SIGN] id=8WpX3k...Qz7u signer=02ab12...ef09 received=1/2
 *
 * DebugLogger.logRpc(LogFormatter.formatRpcError("sendrawtransaction", -26, "dust", 1500));
 * // Output: ✗ [RPC-ERROR] method=sendrawtransaction code=-26 message=dust duration=1.50ms
 * }</pre>
 *
 * @since 0.1.0
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH + 3;

    private LogFormatter() {
    }

    /**
     * Format: [WALLET-CREATE] id=8WpX3k...Qz7u policy=2-of-3 address=bcrt1q...u6h
     */
    public static String formatWalletCreate(String walletId, int m, int n, String address) {
        return String.format(
                "%s[WALLET-CREATE]%s id=%s policy=%d-of-%d address=%s",
                INDIGO, RESET,
                shorten(walletId), m, n, shorten(address));
    }

    /**
     * Format: [TX-INITIATE] id=... wallet=... amount=100000 fee=2410 change=897590 inputs=1
     */
    public static String formatTxInitiate(
            String transactionId, String walletId, long amount, long fee, long change, int inputs) {
        return String.format(
                "%s[TX-INITIATE]%s id=%s wallet=%s amount=%d %sfee=%d%s change=%d inputs=%d",
                LAVENDER, RESET,
                shorten(transactionId), shorten(walletId), amount,
                AMBER, fee, RESET,
                change, inputs);
    }

    /**
     * Format: [TX-SIGN] id=... signer=02ab12...ef09 received=1/2
     */
    public static String formatTxSign(String transactionId, String publicKey, int received, int required) {
        return String.format(
                "%s[TX-SIGN]%s id=%s signer=%s received=%d/%d",
                LAVENDER, RESET,
                shorten(transactionId), shorten(publicKey), received, required);
    }

    /**
     * Format: ✓ [TX-FINALIZE] id=... bytes=380
     */
    public static String formatTxFinalize(String transactionId, int rawLength) {
        return String.format(
                "%s✓%s %s[TX-FINALIZE]%s id=%s bytes=%d",
                TEAL, RESET,
                LAVENDER, RESET,
                shorten(transactionId), rawLength);
    }

    /**
     * Format: ✓ [TX-BROADCAST] id=... hash=1a2b3c...9f0e duration=12.00ms
     */
    public static String formatTxBroadcast(String transactionId, String txHash, long durationMicros) {
        return String.format(
                "%s✓%s %s[TX-BROADCAST]%s id=%s hash=%s %s",
                TEAL, RESET,
                LAVENDER, RESET,
                shorten(transactionId), shorten(txHash), duration(durationMicros));
    }

    /**
     * Format: ✓ [TX-CONFIRM] id=... hash=... confirmations=1
     * or: ○ [TX-CONFIRM] id=... hash=... confirmations=0
     */
    public static String formatTxConfirm(String transactionId, String txHash, long confirmations) {
        boolean confirmed = confirmations > 0;
        String symbol = confirmed ? "✓" : "○";
        String color = confirmed ? TEAL : SLATE;
        return String.format(
                "%s%s%s %s[TX-CONFIRM]%s id=%s hash=%s confirmations=%d",
                color, symbol, RESET,
                color, RESET,
                shorten(transactionId), shorten(txHash), confirmations);
    }

    /**
     * Format: [TX-CANCEL] id=...
     */
    public static String formatTxCancel(String transactionId) {
        return String.format(
                "%s[TX-CANCEL]%s id=%s",
                LAVENDER, RESET,
                shorten(transactionId));
    }

    /**
     * Format: [RPC] method=scantxoutset duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s %s",
                INDIGO, RESET,
                method,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=sendrawtransaction code=-26 message=error duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    static String shorten(String value) {
        if (value == null || value.length() <= HASH_SHORTEN_THRESHOLD) {
            return value;
        }
        return value.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + value.substring(value.length() - HASH_SUFFIX_LENGTH);
    }
}
