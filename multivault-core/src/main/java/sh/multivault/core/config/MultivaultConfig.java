// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.config;

import java.util.Objects;
import sh.multivault.core.chain.BitcoinNetwork;

/**
 * Engine-wide settings.
 *
 * @param network          network addresses and transactions are built for
 * @param defaultFeeRate   sat/vB used when a caller supplies no fee rate
 * @param minUtxoValue     funding outputs at or below this many satoshis are ignored
 * @param walletIdDomain   domain-separation suffix mixed into wallet ids
 * @param historyPageSize  transactions per history page
 * @param maxParticipants  upper bound on {@code n}
 * @since 0.1.0
 */
public record MultivaultConfig(
        BitcoinNetwork network,
        double defaultFeeRate,
        long minUtxoValue,
        String walletIdDomain,
        int historyPageSize,
        int maxParticipants) {

    public static final String DEFAULT_WALLET_ID_DOMAIN = "#multivault_btc_multisig";
    public static final double DEFAULT_FEE_RATE = 1.0;
    public static final int DEFAULT_HISTORY_PAGE_SIZE = 10;
    public static final int DEFAULT_MAX_PARTICIPANTS = 10;

    public MultivaultConfig {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(walletIdDomain, "walletIdDomain");
        if (!(defaultFeeRate > 0) || Double.isInfinite(defaultFeeRate)) {
            throw new IllegalArgumentException("defaultFeeRate must be positive: " + defaultFeeRate);
        }
        if (minUtxoValue < 0) {
            throw new IllegalArgumentException("minUtxoValue must not be negative: " + minUtxoValue);
        }
        if (historyPageSize <= 0) {
            throw new IllegalArgumentException("historyPageSize must be positive: " + historyPageSize);
        }
        if (maxParticipants <= 0 || maxParticipants > 16) {
            throw new IllegalArgumentException("maxParticipants must be in 1..16: " + maxParticipants);
        }
    }

    public static MultivaultConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BitcoinNetwork network = BitcoinNetwork.REGTEST;
        private double defaultFeeRate = DEFAULT_FEE_RATE;
        private long minUtxoValue;
        private String walletIdDomain = DEFAULT_WALLET_ID_DOMAIN;
        private int historyPageSize = DEFAULT_HISTORY_PAGE_SIZE;
        private int maxParticipants = DEFAULT_MAX_PARTICIPANTS;

        private Builder() {
        }

        public Builder network(final BitcoinNetwork network) {
            this.network = network;
            return this;
        }

        public Builder defaultFeeRate(final double defaultFeeRate) {
            this.defaultFeeRate = defaultFeeRate;
            return this;
        }

        public Builder minUtxoValue(final long minUtxoValue) {
            this.minUtxoValue = minUtxoValue;
            return this;
        }

        public Builder walletIdDomain(final String walletIdDomain) {
            this.walletIdDomain = walletIdDomain;
            return this;
        }

        public Builder historyPageSize(final int historyPageSize) {
            this.historyPageSize = historyPageSize;
            return this;
        }

        public Builder maxParticipants(final int maxParticipants) {
            this.maxParticipants = maxParticipants;
            return this;
        }

        public MultivaultConfig build() {
            return new MultivaultConfig(
                    network, defaultFeeRate, minUtxoValue, walletIdDomain, historyPageSize, maxParticipants);
        }
    }
}
