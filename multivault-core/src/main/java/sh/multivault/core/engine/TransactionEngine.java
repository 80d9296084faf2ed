// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.engine;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import sh.multivault.core.DebugLogger;
import sh.multivault.core.LogFormatter;
import sh.multivault.core.config.MultivaultConfig;
import sh.multivault.core.crypto.Fingerprints;
import sh.multivault.core.error.ConflictException;
import sh.multivault.core.error.DuplicateSignerException;
import sh.multivault.core.error.ExternalServiceException;
import sh.multivault.core.error.InsufficientFundsException;
import sh.multivault.core.error.InvalidSignatureException;
import sh.multivault.core.error.NoFundsException;
import sh.multivault.core.error.NotFoundException;
import sh.multivault.core.error.StateException;
import sh.multivault.core.error.ValidationException;
import sh.multivault.core.fee.MultisigInputKind;
import sh.multivault.core.fee.VirtualSizeEstimator;
import sh.multivault.core.model.BroadcastReceipt;
import sh.multivault.core.model.FeeRates;
import sh.multivault.core.model.PendingTransactions;
import sh.multivault.core.model.SignatureProgress;
import sh.multivault.core.model.Transaction;
import sh.multivault.core.model.TransactionHistory;
import sh.multivault.core.model.TransactionStatus;
import sh.multivault.core.model.TransactionSummary;
import sh.multivault.core.model.UnsignedDigests;
import sh.multivault.core.model.Utxo;
import sh.multivault.core.model.Wallet;
import sh.multivault.core.network.ExternalCalls;
import sh.multivault.core.network.FundingNetwork;
import sh.multivault.core.network.SigningCredential;
import sh.multivault.core.network.SigningService;
import sh.multivault.core.registry.WalletRegistry;
import sh.multivault.core.script.ScriptEngine;
import sh.multivault.core.script.ScriptKind;
import sh.multivault.core.script.TransactionTemplate;
import sh.multivault.core.store.RecordLocks;
import sh.multivault.core.store.RecordStore;
import sh.multivault.primitives.Hex;

/**
 * Drives a multisig transaction from initiation through signing, finalization, broadcast and
 * confirmation.
 *
 * <p>
 * Lifecycle:
 *
 * <pre>
 * pending --(threshold reached)--> all_signed --(broadcast)--> broadcasted --(confirmed)--> confirmed
 * pending --(cancel)--> cancelled
 * </pre>
 *
 * <p>
 * <strong>Consistency:</strong> every read-modify-write on a transaction record runs under
 * that record's lock, and each operation validates and computes its result before the single
 * write it performs. A failing collaborator call therefore leaves the stored record untouched.
 * There are no automatic retries.
 *
 * <p>
 * <strong>Thread Safety:</strong> safe for concurrent use.
 *
 * @since 0.1.0
 */
public final class TransactionEngine {

    static final int MAX_ADDRESS_LENGTH = 100;
    static final double MIN_FEE_RATE = 1.0;
    static final double MAX_FEE_RATE = 100_000.0;
    static final long MAX_AMOUNT = 21_000_000L * 100_000_000L;

    private static final MultisigInputKind INPUT_KIND = MultisigInputKind.P2WSH;

    private final MultivaultConfig config;
    private final WalletRegistry wallets;
    private final RecordStore records;
    private final ScriptEngine scripts;
    private final FundingNetwork network;
    private final @Nullable SigningService signer;
    private final RecordLocks locks;
    private final Clock clock;

    public TransactionEngine(
            final MultivaultConfig config,
            final WalletRegistry wallets,
            final RecordStore records,
            final ScriptEngine scripts,
            final FundingNetwork network,
            final @Nullable SigningService signer,
            final RecordLocks locks,
            final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.wallets = Objects.requireNonNull(wallets, "wallets");
        this.records = Objects.requireNonNull(records, "records");
        this.scripts = Objects.requireNonNull(scripts, "scripts");
        this.network = Objects.requireNonNull(network, "network");
        this.signer = signer;
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds an unsigned transaction spending every spendable output of the wallet, paying
     * {@code amount} to {@code recipientAddress} and returning any remainder to the wallet.
     *
     * <p>
     * A change output is added for any remainder above zero. Bitcoin Core refuses to relay
     * outputs below its dust limit (546 sat for most output types), so a transaction whose
     * change lands between 1 and the dust limit is accepted here but rejected at
     * {@link #broadcast}.
     *
     * @param amount  sat, at most the 21 million BTC supply
     * @param feeRate sat/vB, or {@code null} for the configured default
     * @throws NotFoundException          if the wallet does not exist
     * @throws NoFundsException           if the wallet has no spendable outputs
     * @throws InsufficientFundsException if the outputs cannot cover amount plus fee
     * @throws ConflictException          if an identical transaction was already initiated
     */
    public Transaction initiate(
            final String walletId,
            final String recipientAddress,
            final long amount,
            final @Nullable Double feeRate,
            final @Nullable String note) {
        validateAddress(recipientAddress);
        if (amount <= 0 || amount > MAX_AMOUNT) {
            throw new ValidationException("Amount must be in 1.." + MAX_AMOUNT + " sat: " + amount);
        }
        final double rate = feeRate == null ? config.defaultFeeRate() : validateFeeRate(feeRate);
        final Wallet wallet = wallets.get(walletId);
        final ScriptKind recipientKind = scripts.outputKind(recipientAddress);

        final List<Utxo> utxos = wallets.spendableOutputs(wallet.address());
        if (utxos.isEmpty()) {
            throw new NoFundsException(wallet.address());
        }

        final TransactionTemplate template = scripts.newTemplate(wallet.m(), wallet.publicKeys());
        for (Utxo utxo : utxos) {
            scripts.addInput(template, utxo);
        }
        final long total = template.totalInputValue();
        final long vsize = VirtualSizeEstimator.estimate(
                INPUT_KIND, wallet.m(), wallet.n(), utxos.size(), List.of(recipientKind));
        final long fee = VirtualSizeEstimator.fee(vsize, rate);
        final long required = Math.addExact(amount, fee);
        if (total < required) {
            throw new InsufficientFundsException(total, required);
        }

        scripts.addOutput(template, recipientAddress, amount);
        final long change = total - required;
        if (change > 0) {
            scripts.addOutput(template, wallet.address(), change);
        }

        final byte[] serialized = scripts.serialize(template);
        final String transactionId = Fingerprints.transactionId(serialized);
        final Transaction tx = Transaction.pending(transactionId, wallet.walletId(), recipientAddress, amount,
                fee, change, Hex.encodeNoPrefix(serialized), utxos.size(), wallet.m(), now(), note);

        return locks.withLock(transactionId, () -> {
            if (records.transaction(transactionId).isPresent()) {
                throw new ConflictException("Transaction " + transactionId + " was already initiated");
            }
            records.putTransaction(tx);
            DebugLogger.logTx(LogFormatter.formatTxInitiate(
                    transactionId, wallet.walletId(), amount, fee, change, utxos.size()));
            return tx;
        });
    }

    public Transaction initiate(final String walletId, final String recipientAddress, final long amount) {
        return initiate(walletId, recipientAddress, amount, null, null);
    }

    /**
     * The digest each co-signer must sign, one per input, as lowercase hex.
     */
    public UnsignedDigests unsignedDigests(final String transactionId) {
        final Transaction tx = load(transactionId);
        requirePending(tx);
        final TransactionTemplate template = template(tx);
        final List<String> digests = new ArrayList<>(template.inputCount());
        for (int i = 0; i < template.inputCount(); i++) {
            digests.add(Hex.encodeNoPrefix(scripts.unsignedDigest(template, i)));
        }
        return new UnsignedDigests(transactionId, digests);
    }

    /**
     * Records one signer's signatures, one per input in input order. Reaching the threshold
     * finalizes the transaction.
     *
     * @throws StateException            if the transaction is no longer pending
     * @throws DuplicateSignerException  if {@code publicKey} has already signed
     * @throws InvalidSignatureException if any signature is rejected; nothing is recorded
     */
    public SignatureProgress submitSignature(
            final String transactionId, final String publicKey, final List<String> signatures) {
        if (publicKey == null || !Hex.isHex(publicKey)) {
            throw new ValidationException("Public key is not hex: " + publicKey);
        }
        if (signatures == null) {
            throw new ValidationException("signatures must not be null");
        }
        final String signerKey = Hex.cleanPrefix(publicKey).toLowerCase();

        return locks.withLock(transactionId, () -> {
            final Transaction tx = load(transactionId);
            requirePending(tx);
            if (tx.hasSigned(signerKey)) {
                throw new DuplicateSignerException(transactionId, signerKey);
            }
            if (signatures.size() != tx.inputCount()) {
                throw new InvalidSignatureException("Expected " + tx.inputCount()
                        + " signatures, one per input, got " + signatures.size());
            }

            final TransactionTemplate template = template(tx);
            final List<String> normalized = new ArrayList<>(signatures.size());
            for (int i = 0; i < signatures.size(); i++) {
                final String sig = signatures.get(i);
                if (sig == null || !Hex.isHex(sig)) {
                    throw new InvalidSignatureException(i, "signature is not hex");
                }
                final byte[] bytes = Hex.decode(sig);
                scripts.applySignature(template, i, signerKey, bytes);
                normalized.add(Hex.encodeNoPrefix(bytes));
            }

            Transaction next = tx.withSignature(
                    signerKey, normalized, Hex.encodeNoPrefix(scripts.serialize(template)));
            DebugLogger.logTx(LogFormatter.formatTxSign(
                    transactionId, signerKey, next.signaturesReceived(), next.requiredSignatures()));
            if (next.signaturesReceived() == next.requiredSignatures()) {
                final byte[] raw = scripts.finalizeTemplate(template);
                next = next.finalized(Hex.encodeNoPrefix(raw));
                DebugLogger.logTx(LogFormatter.formatTxFinalize(transactionId, raw.length));
            }
            records.putTransaction(next);
            return SignatureProgress.of(next);
        });
    }

    /**
     * Signs every input through the signing service with {@code credential}'s key and submits
     * the result as {@code publicKey}'s signatures.
     *
     * @throws IllegalStateException if no signing service was configured
     */
    public SignatureProgress cosign(
            final String transactionId, final String publicKey, final SigningCredential credential) {
        if (signer == null) {
            throw new IllegalStateException("No signing service configured");
        }
        Objects.requireNonNull(credential, "credential");
        if (publicKey == null || !Hex.isHex(publicKey)) {
            throw new ValidationException("Public key is not hex: " + publicKey);
        }
        final Transaction tx = load(transactionId);
        requirePending(tx);
        final String signerKey = Hex.cleanPrefix(publicKey).toLowerCase();
        if (tx.hasSigned(signerKey)) {
            throw new DuplicateSignerException(transactionId, signerKey);
        }
        final List<String> signatures = new ArrayList<>();
        for (String digest : unsignedDigests(transactionId).digests()) {
            final byte[] sig = ExternalCalls.call("sign", () -> signer.sign(Hex.decode(digest), credential));
            signatures.add(Hex.encodeNoPrefix(sig));
        }
        return submitSignature(transactionId, publicKey, signatures);
    }

    /**
     * @throws StateException unless the transaction is pending
     */
    public Transaction cancel(final String transactionId) {
        return locks.withLock(transactionId, () -> {
            final Transaction next = load(transactionId).cancelled();
            records.putTransaction(next);
            DebugLogger.logTx(LogFormatter.formatTxCancel(transactionId));
            return next;
        });
    }

    /**
     * Submits the finalized transaction to the network.
     *
     * @throws StateException unless the transaction is all_signed
     */
    public BroadcastReceipt broadcast(final String transactionId) {
        return locks.withLock(transactionId, () -> {
            final Transaction tx = load(transactionId);
            if (!tx.status().canTransitionTo(TransactionStatus.BROADCASTED)) {
                throw new StateException(tx.status(), TransactionStatus.BROADCASTED);
            }
            final byte[] raw = Hex.decode(tx.signedTransaction());
            final long start = System.nanoTime();
            final String txHash = ExternalCalls.call("broadcast", () -> network.broadcast(raw));
            final long micros = (System.nanoTime() - start) / 1_000L;
            if (txHash == null || txHash.isBlank()) {
                throw new ExternalServiceException("broadcast returned no transaction id");
            }
            final Transaction next = tx.broadcasted(txHash, now());
            records.putTransaction(next);
            DebugLogger.logTx(LogFormatter.formatTxBroadcast(transactionId, txHash, micros));
            return new BroadcastReceipt(transactionId, next.status(), txHash, next.broadcastTime());
        });
    }

    /**
     * Current status. A broadcasted transaction is checked against the network and moves to
     * confirmed once it has at least one confirmation. Repeated calls are safe.
     */
    public TransactionSummary getStatus(final String transactionId) {
        return locks.withLock(transactionId, () -> {
            final Transaction tx = load(transactionId);
            if (tx.status() != TransactionStatus.BROADCASTED) {
                return TransactionSummary.of(tx);
            }
            final long confirmations = ExternalCalls.call(
                    "getConfirmations", () -> network.getConfirmations(tx.txHash()));
            DebugLogger.logTx(LogFormatter.formatTxConfirm(transactionId, tx.txHash(), confirmations));
            if (confirmations <= 0) {
                return TransactionSummary.of(tx);
            }
            final Transaction next = tx.confirmed();
            records.putTransaction(next);
            return TransactionSummary.of(next);
        });
    }

    /**
     * Full record, including template and collected signatures.
     */
    public Transaction get(final String transactionId) {
        return load(transactionId);
    }

    /**
     * Pending transactions of a wallet, oldest first.
     */
    public PendingTransactions pendingTransactions(final String walletId) {
        final Wallet wallet = wallets.get(walletId);
        final List<TransactionSummary> pending = records.transactionsOf(walletId).stream()
                .filter(tx -> tx.status() == TransactionStatus.PENDING)
                .sorted(Comparator.comparing((Transaction tx) -> Instant.parse(tx.initiatedTime()))
                        .thenComparing(Transaction::transactionId))
                .map(TransactionSummary::of)
                .toList();
        return new PendingTransactions(walletId, wallet.address(), pending);
    }

    /**
     * Non-pending transactions of a wallet, newest first, one page at a time.
     *
     * @param page 1-based page number
     */
    public TransactionHistory history(final String walletId, final int page) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1: " + page);
        }
        final Wallet wallet = wallets.get(walletId);
        final List<TransactionSummary> all = records.transactionsOf(walletId).stream()
                .filter(tx -> tx.status() != TransactionStatus.PENDING)
                .sorted(Comparator.comparing((Transaction tx) -> Instant.parse(tx.initiatedTime()))
                        .thenComparing(Transaction::transactionId)
                        .reversed())
                .map(TransactionSummary::of)
                .toList();
        final int size = config.historyPageSize();
        final long from = (long) (page - 1) * size;
        final List<TransactionSummary> slice = from >= all.size()
                ? List.of()
                : all.subList((int) from, (int) Math.min(all.size(), from + size));
        return new TransactionHistory(walletId, wallet.address(), slice, page, size, all.size());
    }

    /**
     * Virtual size {@link #initiate} would assume for a transfer to {@code recipientAddress}
     * spending the wallet's current outputs (at least one).
     */
    public long estimateVirtualSize(final String walletId, final String recipientAddress) {
        validateAddress(recipientAddress);
        final Wallet wallet = wallets.get(walletId);
        final ScriptKind recipientKind = scripts.outputKind(recipientAddress);
        final int inputs = Math.max(1, wallets.spendableOutputs(wallet.address()).size());
        return VirtualSizeEstimator.estimate(INPUT_KIND, wallet.m(), wallet.n(), inputs, List.of(recipientKind));
    }

    public FeeRates feeRates() {
        return ExternalCalls.call("estimateFeeRate", network::estimateFeeRate);
    }

    private Transaction load(final String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new ValidationException("transactionId must not be blank");
        }
        return records.transaction(transactionId).orElseThrow(() -> NotFoundException.transaction(transactionId));
    }

    private TransactionTemplate template(final Transaction tx) {
        return scripts.deserialize(Hex.decode(tx.template()));
    }

    private static void requirePending(final Transaction tx) {
        if (tx.status() != TransactionStatus.PENDING) {
            throw new StateException(tx.status(), TransactionStatus.ALL_SIGNED,
                    "Transaction " + tx.transactionId() + " no longer accepts signatures");
        }
    }

    private static void validateAddress(final String address) {
        if (address == null || address.isBlank() || address.length() > MAX_ADDRESS_LENGTH) {
            throw new ValidationException("Recipient address must be 1.." + MAX_ADDRESS_LENGTH + " characters");
        }
    }

    private static double validateFeeRate(final double feeRate) {
        if (Double.isNaN(feeRate) || feeRate < MIN_FEE_RATE || feeRate > MAX_FEE_RATE) {
            throw new ValidationException("Fee rate must be between " + MIN_FEE_RATE + " and " + MAX_FEE_RATE
                    + " sat/vB: " + feeRate);
        }
        return feeRate;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
