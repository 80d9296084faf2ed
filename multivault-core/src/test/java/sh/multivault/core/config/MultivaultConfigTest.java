// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import sh.multivault.core.chain.BitcoinNetwork;

class MultivaultConfigTest {

    @Test
    void defaults() {
        final MultivaultConfig config = MultivaultConfig.defaults();

        assertEquals(BitcoinNetwork.REGTEST, config.network());
        assertEquals(1.0, config.defaultFeeRate());
        assertEquals(0L, config.minUtxoValue());
        assertEquals("#multivault_btc_multisig", config.walletIdDomain());
        assertEquals(10, config.historyPageSize());
        assertEquals(10, config.maxParticipants());
    }

    @Test
    void builderOverrides() {
        final MultivaultConfig config = MultivaultConfig.builder()
                .network(BitcoinNetwork.TESTNET)
                .defaultFeeRate(3.5)
                .minUtxoValue(546L)
                .historyPageSize(25)
                .build();

        assertEquals(BitcoinNetwork.TESTNET, config.network());
        assertEquals(3.5, config.defaultFeeRate());
        assertEquals(546L, config.minUtxoValue());
        assertEquals(25, config.historyPageSize());
    }

    @Test
    void rejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> MultivaultConfig.builder().defaultFeeRate(0).build());
        assertThrows(IllegalArgumentException.class, () -> MultivaultConfig.builder().minUtxoValue(-1).build());
        assertThrows(IllegalArgumentException.class, () -> MultivaultConfig.builder().historyPageSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> MultivaultConfig.builder().maxParticipants(17).build());
        assertThrows(NullPointerException.class, () -> MultivaultConfig.builder().network(null).build());
    }
}
