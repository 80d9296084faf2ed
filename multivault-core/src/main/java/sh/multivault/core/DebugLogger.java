// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.multivault.core.MultivaultDebug.Channel;

/**
 * Debug output for wallet, transaction, RPC and HSM events, gated per channel by
 * {@link MultivaultDebug}.
 *
 * <p>
 * Messages are {@link String#format} templates. Every line passes through
 * {@link LogSanitizer} before it is written, to stdout when attached to a terminal and
 * otherwise to the channel's SLF4J logger.
 */
public final class DebugLogger {

    private static final Map<Channel, Logger> LOGGERS = new EnumMap<>(Channel.class);

    static {
        for (Channel channel : Channel.values()) {
            LOGGERS.put(channel, LoggerFactory.getLogger(channel.loggerName()));
        }
    }

    private DebugLogger() {
    }

    public static void logWallet(final String message, final Object... args) {
        log(Channel.WALLET, message, args);
    }

    public static void logTx(final String message, final Object... args) {
        log(Channel.TX, message, args);
    }

    public static void logRpc(final String message, final Object... args) {
        log(Channel.RPC, message, args);
    }

    public static void logHsm(final String message, final Object... args) {
        log(Channel.HSM, message, args);
    }

    public static void log(final Channel channel, final String message, final Object... args) {
        if (!MultivaultDebug.isEnabled(channel)) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOGGERS.get(channel).info(sanitized);
        }
    }
}
