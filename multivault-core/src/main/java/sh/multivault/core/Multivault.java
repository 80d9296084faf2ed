// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core;

import java.time.Clock;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.multivault.core.config.MultivaultConfig;
import sh.multivault.core.engine.TransactionEngine;
import sh.multivault.core.network.FundingNetwork;
import sh.multivault.core.network.SigningService;
import sh.multivault.core.registry.WalletRegistry;
import sh.multivault.core.script.BitcoinjScriptEngine;
import sh.multivault.core.script.ScriptEngine;
import sh.multivault.core.store.InMemoryKeyValueStore;
import sh.multivault.core.store.KeyValueStore;
import sh.multivault.core.store.RecordLocks;
import sh.multivault.core.store.RecordStore;

/**
 * Entry point wiring the wallet registry and transaction engine to their collaborators.
 *
 * <pre>{@code
 * Multivault vault = Multivault.builder()
 *         .config(MultivaultConfig.builder().network(BitcoinNetwork.TESTNET).build())
 *         .store(myStore)
 *         .network(new BitcoinCoreNetwork(provider))
 *         .build();
 *
 * Wallet wallet = vault.wallets().create(2, 3, participants, "treasury");
 * Transaction tx = vault.transactions().initiate(wallet.walletId(), recipient, 100_000L, 10.0, null);
 * }</pre>
 *
 * <p>
 * The registry and engine share one lock table, so a single {@code Multivault} instance per
 * store gives per-record mutual exclusion across all callers in the process.
 *
 * @since 0.1.0
 */
public final class Multivault {

    private final MultivaultConfig config;
    private final WalletRegistry wallets;
    private final TransactionEngine transactions;

    private Multivault(final Builder builder) {
        this.config = builder.config;
        final ScriptEngine scripts =
                builder.scripts != null ? builder.scripts : new BitcoinjScriptEngine(config.network());
        final RecordStore records = new RecordStore(builder.store);
        final RecordLocks locks = new RecordLocks();
        this.wallets = new WalletRegistry(config, records, scripts, builder.network, locks, builder.clock);
        this.transactions = new TransactionEngine(
                config, wallets, records, scripts, builder.network, builder.signer, locks, builder.clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    public MultivaultConfig config() {
        return config;
    }

    public WalletRegistry wallets() {
        return wallets;
    }

    public TransactionEngine transactions() {
        return transactions;
    }

    public static final class Builder {
        private MultivaultConfig config = MultivaultConfig.defaults();
        private KeyValueStore store = new InMemoryKeyValueStore();
        private @Nullable ScriptEngine scripts;
        private @Nullable FundingNetwork network;
        private @Nullable SigningService signer;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder config(final MultivaultConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder store(final KeyValueStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        /**
         * Overrides the script engine. Defaults to {@link BitcoinjScriptEngine} on the configured
         * network.
         */
        public Builder scripts(final ScriptEngine scripts) {
            this.scripts = scripts;
            return this;
        }

        public Builder network(final FundingNetwork network) {
            this.network = network;
            return this;
        }

        public Builder signer(final SigningService signer) {
            this.signer = signer;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * @throws IllegalStateException if no network collaborator was supplied
         */
        public Multivault build() {
            if (network == null) {
                throw new IllegalStateException("A FundingNetwork is required");
            }
            return new Multivault(this);
        }
    }
}
