// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.bitcoinj.core.NetworkParameters;
import org.junit.jupiter.api.Test;

class BitcoinNetworkTest {

    @Test
    void mapsToBitcoinjParameters() {
        assertEquals(NetworkParameters.ID_MAINNET, BitcoinNetwork.MAINNET.params().getId());
        assertEquals(NetworkParameters.ID_TESTNET, BitcoinNetwork.TESTNET.params().getId());
        assertEquals(NetworkParameters.ID_REGTEST, BitcoinNetwork.REGTEST.params().getId());
    }

    @Test
    void bech32PrefixFollowsNetwork() {
        assertEquals("bc", BitcoinNetwork.MAINNET.params().getSegwitAddressHrp());
        assertEquals("tb", BitcoinNetwork.TESTNET.params().getSegwitAddressHrp());
        assertEquals("bcrt", BitcoinNetwork.REGTEST.params().getSegwitAddressHrp());
    }
}
