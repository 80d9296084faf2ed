// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Debug logging switches, one per {@link Channel}. All channels are off unless the
 * {@code multivault.debug} system property names them at startup, e.g.
 * {@code -Dmultivault.debug=wallet,tx} or {@code -Dmultivault.debug=all}.
 *
 * <p>
 * The enabled set is replaced as a whole on every change, so readers never need a lock.
 */
public final class MultivaultDebug {

    static final String PROPERTY = "multivault.debug";

    /**
     * Independent debug streams. Each one logs to {@code sh.multivault.debug.<id>}.
     */
    public enum Channel {
        /** Wallet registration. */
        WALLET("wallet"),
        /** Transaction lifecycle: initiate, sign, finalize, broadcast, confirm, cancel. */
        TX("tx"),
        /** Bitcoin Core JSON-RPC traffic. */
        RPC("rpc"),
        /** Remote HSM signing requests. */
        HSM("hsm");

        private final String id;

        Channel(final String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }

        String loggerName() {
            return "sh.multivault.debug." + id;
        }
    }

    private static volatile Set<Channel> enabled = parse(System.getProperty(PROPERTY));

    private MultivaultDebug() {
    }

    /**
     * @return true if at least one channel is on
     */
    public static boolean isEnabled() {
        return !enabled.isEmpty();
    }

    public static boolean isEnabled(final Channel channel) {
        return enabled.contains(channel);
    }

    /**
     * Turns every channel on or off.
     */
    public static synchronized void setEnabled(final boolean on) {
        enabled = on ? freeze(EnumSet.allOf(Channel.class)) : freeze(EnumSet.noneOf(Channel.class));
    }

    public static synchronized void set(final Channel channel, final boolean on) {
        final EnumSet<Channel> next = enabled.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(enabled);
        if (on) {
            next.add(channel);
        } else {
            next.remove(channel);
        }
        enabled = freeze(next);
    }

    /**
     * Parses a comma separated channel list. {@code all} enables every channel; unknown
     * names are ignored.
     */
    static Set<Channel> parse(final @Nullable String value) {
        final EnumSet<Channel> channels = EnumSet.noneOf(Channel.class);
        if (value == null || value.isBlank()) {
            return freeze(channels);
        }
        for (String token : value.split(",")) {
            final String name = token.trim().toLowerCase(Locale.ROOT);
            if (name.equals("all") || name.equals("true")) {
                return freeze(EnumSet.allOf(Channel.class));
            }
            for (Channel channel : Channel.values()) {
                if (channel.id().equals(name)) {
                    channels.add(channel);
                }
            }
        }
        return freeze(channels);
    }

    private static Set<Channel> freeze(final EnumSet<Channel> channels) {
        return Collections.unmodifiableSet(channels);
    }
}
