// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.chain;

import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;

/**
 * Bitcoin networks a wallet can live on.
 *
 * <p>
 * The network decides the bech32 human-readable part of derived addresses ({@code bc},
 * {@code tb}, {@code bcrt}) and which recipient addresses are accepted.
 *
 * @since 0.1.0
 */
public enum BitcoinNetwork {
    MAINNET,
    TESTNET,
    REGTEST;

    public NetworkParameters params() {
        return switch (this) {
            case MAINNET -> MainNetParams.get();
            case TESTNET -> TestNet3Params.get();
            case REGTEST -> RegTestParams.get();
        };
    }
}
