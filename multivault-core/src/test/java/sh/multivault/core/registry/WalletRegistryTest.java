// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static sh.multivault.core.TestKeys.A;
import static sh.multivault.core.TestKeys.B;
import static sh.multivault.core.TestKeys.C;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import sh.multivault.core.MultivaultDebug;
import sh.multivault.core.TestKeys;
import sh.multivault.core.chain.BitcoinNetwork;
import sh.multivault.core.config.MultivaultConfig;
import sh.multivault.core.crypto.Fingerprints;
import sh.multivault.core.error.ConflictException;
import sh.multivault.core.error.ExternalServiceException;
import sh.multivault.core.error.NotFoundException;
import sh.multivault.core.error.ValidationException;
import sh.multivault.core.model.Participant;
import sh.multivault.core.model.Utxo;
import sh.multivault.core.model.Wallet;
import sh.multivault.core.model.WalletBalance;
import sh.multivault.core.network.FundingNetwork;
import sh.multivault.core.script.BitcoinjScriptEngine;
import sh.multivault.core.store.InMemoryKeyValueStore;
import sh.multivault.core.store.RecordLocks;
import sh.multivault.core.store.RecordStore;

@ExtendWith(MockitoExtension.class)
class WalletRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private FundingNetwork network;

    private InMemoryKeyValueStore store;
    private WalletRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        final MultivaultConfig config = MultivaultConfig.builder().minUtxoValue(546L).build();
        registry = new WalletRegistry(config, new RecordStore(store),
                new BitcoinjScriptEngine(BitcoinNetwork.REGTEST), network, new RecordLocks(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void walletCreationLogsOnWalletChannelOnly() {
        final Logger debug = (Logger) LoggerFactory.getLogger("sh.multivault.debug");
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debug.addAppender(appender);
        try {
            MultivaultDebug.set(MultivaultDebug.Channel.TX, true);
            registry.create(1, 2, TestKeys.participants(A, B));
            assertTrue(appender.list.isEmpty());

            MultivaultDebug.set(MultivaultDebug.Channel.WALLET, true);
            registry.create(2, 2, TestKeys.participants(A, B));
            assertEquals(1, appender.list.size());
            assertEquals("sh.multivault.debug.wallet", appender.list.get(0).getLoggerName());
            assertTrue(appender.list.get(0).getFormattedMessage().contains("[WALLET-CREATE]"));
        } finally {
            MultivaultDebug.setEnabled(false);
            debug.detachAppender(appender);
        }
    }

    @Test
    void createsAndPersistsWallet() {
        final Wallet wallet = registry.create(2, 3, TestKeys.participants(A, B, C), "treasury");

        assertEquals(Fingerprints.walletId(TestKeys.hexKeys(A, B, C), MultivaultConfig.DEFAULT_WALLET_ID_DOMAIN),
                wallet.walletId());
        assertTrue(wallet.address().startsWith("bcrt1q"));
        assertEquals(2, wallet.m());
        assertEquals(3, wallet.n());
        assertEquals("treasury", wallet.name());
        assertEquals(NOW.toString(), wallet.creationTime());
        assertEquals(TestKeys.hexKeys(A, B, C), wallet.publicKeys());
        assertTrue(store.get("wallet:" + wallet.walletId()).isPresent());
        assertEquals(wallet, registry.get(wallet.walletId()));
        verifyNoInteractions(network);
    }

    @Test
    void identicalKeysInSameOrderConflict() {
        final Wallet first = registry.create(2, 3, TestKeys.participants(A, B, C), "first");

        final ConflictException ex = assertThrows(ConflictException.class,
                () -> registry.create(2, 3, TestKeys.participants(A, B, C), "second"));

        assertTrue(ex.getMessage().contains(first.walletId()));
        assertEquals("first", registry.get(first.walletId()).name());
    }

    @Test
    void participantOrderChangesIdentity() {
        final Wallet abc = registry.create(2, 3, TestKeys.participants(A, B, C));
        final Wallet bac = registry.create(2, 3, TestKeys.participants(B, A, C));

        assertNotEquals(abc.walletId(), bac.walletId());
        assertNotEquals(abc.address(), bac.address());
    }

    @Test
    void keysAreNormalizedBeforeDerivation() {
        final List<Participant> shouty = List.of(
                new Participant("0x" + TestKeys.hex(A).toUpperCase(), "alice"),
                new Participant(TestKeys.hex(B), "bob"));

        final Wallet wallet = registry.create(1, 2, shouty);

        assertEquals(TestKeys.hexKeys(A, B), wallet.publicKeys());
        assertEquals("alice", wallet.participants().get(0).userId());
    }

    @Test
    void validatesPolicy() {
        assertThrows(ValidationException.class, () -> registry.create(0, 3, TestKeys.participants(A, B, C)));
        assertThrows(ValidationException.class, () -> registry.create(4, 3, TestKeys.participants(A, B, C)));
        assertThrows(ValidationException.class, () -> registry.create(2, 2, TestKeys.participants(A, B, C)));
        assertThrows(ValidationException.class, () -> registry.create(2, 3, TestKeys.participants(A, B, A)));
        assertThrows(ValidationException.class,
                () -> registry.create(1, 11, TestKeys.participants(A, B, C)));
        assertThrows(ValidationException.class,
                () -> registry.create(1, 1, TestKeys.participants(A), "x".repeat(101)));
        assertThrows(ValidationException.class,
                () -> registry.create(1, 1, List.of(new Participant("not-hex", "u"))));
        assertEquals(0, store.size());
    }

    @Test
    void unknownWalletIsNotFound() {
        final NotFoundException ex = assertThrows(NotFoundException.class, () -> registry.get("nope"));

        assertEquals("nope", ex.id());
        assertFalse(registry.exists("nope"));
    }

    @Test
    void balanceSumsOutputsAboveDustFloor() {
        final Wallet wallet = registry.create(2, 3, TestKeys.participants(A, B, C));
        when(network.listSpendableOutputs(wallet.address())).thenReturn(List.of(
                new Utxo(TestKeys.txid(1), 0, 50_000L),
                new Utxo(TestKeys.txid(2), 1, 546L),
                new Utxo(TestKeys.txid(3), 0, 25_000L)));

        final WalletBalance balance = registry.balance(wallet.walletId());

        assertEquals(75_000L, balance.confirmedBalance());
        assertEquals(2, balance.utxoCount());
        assertEquals(wallet.address(), balance.address());
    }

    @Test
    void networkFailureSurfacesAsExternalServiceError() {
        final Wallet wallet = registry.create(2, 3, TestKeys.participants(A, B, C));
        when(network.listSpendableOutputs(wallet.address())).thenThrow(new IllegalStateException("node down"));

        final ExternalServiceException ex =
                assertThrows(ExternalServiceException.class, () -> registry.balance(wallet.walletId()));
        assertTrue(ex.getMessage().contains("node down"));
    }
}
