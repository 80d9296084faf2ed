// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.registry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import sh.multivault.core.DebugLogger;
import sh.multivault.core.LogFormatter;
import sh.multivault.core.config.MultivaultConfig;
import sh.multivault.core.crypto.Fingerprints;
import sh.multivault.core.error.ConflictException;
import sh.multivault.core.error.NotFoundException;
import sh.multivault.core.error.ValidationException;
import sh.multivault.core.model.Participant;
import sh.multivault.core.model.Utxo;
import sh.multivault.core.model.Wallet;
import sh.multivault.core.model.WalletBalance;
import sh.multivault.core.network.ExternalCalls;
import sh.multivault.core.network.FundingNetwork;
import sh.multivault.core.script.MultisigScript;
import sh.multivault.core.script.ScriptEngine;
import sh.multivault.core.store.RecordLocks;
import sh.multivault.core.store.RecordStore;
import sh.multivault.primitives.Hex;

/**
 * Creates and looks up multisig wallet records.
 *
 * <p>
 * A wallet id is a pure function of the participant keys in the order supplied and the
 * configured domain suffix, so creating the same key list twice is reported as a
 * {@link ConflictException} rather than silently overwriting the first record.
 *
 * <p>
 * <strong>Thread Safety:</strong> safe for concurrent use; creation of one wallet id is
 * serialized through {@link RecordLocks}.
 *
 * @since 0.1.0
 */
public final class WalletRegistry {

    static final int MAX_NAME_LENGTH = 100;

    private final MultivaultConfig config;
    private final RecordStore records;
    private final ScriptEngine scripts;
    private final FundingNetwork network;
    private final RecordLocks locks;
    private final Clock clock;

    public WalletRegistry(
            final MultivaultConfig config,
            final RecordStore records,
            final ScriptEngine scripts,
            final FundingNetwork network,
            final RecordLocks locks,
            final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.records = Objects.requireNonNull(records, "records");
        this.scripts = Objects.requireNonNull(scripts, "scripts");
        this.network = Objects.requireNonNull(network, "network");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates an {@code m}-of-{@code n} wallet over the participants, in the order given.
     *
     * @throws ValidationException if the policy, participant list or name is malformed
     * @throws ConflictException   if a wallet with the same key list already exists
     */
    public Wallet create(final int m, final int n, final List<Participant> participants, final @Nullable String name) {
        validatePolicy(m, n);
        if (participants == null || participants.size() != n) {
            throw new ValidationException("Expected " + n + " participants, got "
                    + (participants == null ? 0 : participants.size()));
        }
        if (name != null && name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Wallet name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        final List<Participant> normalized = normalize(participants);
        final List<String> keys = normalized.stream().map(Participant::publicKey).toList();

        final String walletId = Fingerprints.walletId(keys, config.walletIdDomain());
        final MultisigScript script = scripts.deriveAddress(m, keys);
        final Wallet wallet = new Wallet(walletId, script.address(), script.redeemScript(), m, n,
                name == null ? "" : name, Instant.now(clock).toString(), normalized);

        return locks.withLock(walletId, () -> {
            if (records.hasWallet(walletId)) {
                throw new ConflictException("Wallet " + walletId + " already exists for these participants");
            }
            records.putWallet(wallet);
            DebugLogger.logWallet(LogFormatter.formatWalletCreate(walletId, m, n, wallet.address()));
            return wallet;
        });
    }

    public Wallet create(final int m, final int n, final List<Participant> participants) {
        return create(m, n, participants, null);
    }

    /**
     * @throws NotFoundException if no wallet has this id
     */
    public Wallet get(final String walletId) {
        requireId(walletId);
        return records.wallet(walletId).orElseThrow(() -> NotFoundException.wallet(walletId));
    }

    public boolean exists(final String walletId) {
        requireId(walletId);
        return records.hasWallet(walletId);
    }

    /**
     * Sums the wallet's spendable outputs above the configured dust floor.
     */
    public WalletBalance balance(final String walletId) {
        final Wallet wallet = get(walletId);
        final List<Utxo> utxos = spendableOutputs(wallet.address());
        long total = 0;
        for (Utxo utxo : utxos) {
            total = Math.addExact(total, utxo.amount());
        }
        return new WalletBalance(walletId, wallet.address(), total, utxos.size());
    }

    /**
     * Funding outputs of {@code address} worth more than {@code minUtxoValue}.
     */
    public List<Utxo> spendableOutputs(final String address) {
        final List<Utxo> all = ExternalCalls.call("listSpendableOutputs", () -> network.listSpendableOutputs(address));
        final List<Utxo> spendable = new ArrayList<>();
        for (Utxo utxo : all) {
            if (utxo.amount() > config.minUtxoValue()) {
                spendable.add(utxo);
            }
        }
        return spendable;
    }

    private void validatePolicy(final int m, final int n) {
        if (m <= 0 || n <= 0) {
            throw new ValidationException("m and n must be positive, got " + m + "-of-" + n);
        }
        if (m > n) {
            throw new ValidationException("Threshold " + m + " exceeds participant count " + n);
        }
        if (n > config.maxParticipants()) {
            throw new ValidationException("At most " + config.maxParticipants() + " participants are supported");
        }
    }

    private static List<Participant> normalize(final List<Participant> participants) {
        final List<Participant> normalized = new ArrayList<>(participants.size());
        final Set<String> seen = new HashSet<>();
        for (Participant participant : participants) {
            if (participant == null) {
                throw new ValidationException("Participant must not be null");
            }
            final String key = participant.publicKey().trim();
            if (!Hex.isHex(key)) {
                throw new ValidationException("Public key is not hex: " + participant.publicKey());
            }
            final String canonical = Hex.cleanPrefix(key).toLowerCase();
            if (!seen.add(canonical)) {
                throw new ValidationException("Duplicate public key " + canonical);
            }
            normalized.add(new Participant(canonical, participant.userId()));
        }
        return normalized;
    }

    private static void requireId(final String walletId) {
        if (walletId == null || walletId.isBlank()) {
            throw new ValidationException("walletId must not be blank");
        }
    }
}
