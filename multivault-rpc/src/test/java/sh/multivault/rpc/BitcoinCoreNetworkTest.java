// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sh.multivault.core.model.FeeRates;
import sh.multivault.core.model.NodeHealth;
import sh.multivault.core.model.Utxo;

@ExtendWith(MockitoExtension.class)
class BitcoinCoreNetworkTest {

    private static final String ADDRESS = "bcrt1qrp33g0q5c5txsp9arysrx4k6zdkfs4nce4xj0gdcccefvpysxf3qzf5wc";
    private static final String TXID = "ab".repeat(32);

    @Mock
    private BitcoinRpcProvider provider;

    private BitcoinCoreNetwork network;

    @BeforeEach
    void setUp() {
        network = new BitcoinCoreNetwork(provider);
    }

    @Test
    void scansUtxoSetForAddress() {
        when(provider.send("scantxoutset", List.of("start", List.of("addr(" + ADDRESS + ")"))))
                .thenReturn(result(Map.of(
                        "success", true,
                        "unspents", List.of(
                                Map.of("txid", TXID, "vout", 1, "amount", new BigDecimal("0.00500000")),
                                Map.of("txid", TXID, "vout", 3, "amount", new BigDecimal("1.23456789"))))));

        final List<Utxo> utxos = network.listSpendableOutputs(ADDRESS);

        assertEquals(List.of(new Utxo(TXID, 1, 500_000L), new Utxo(TXID, 3, 123_456_789L)), utxos);
    }

    @Test
    void emptyScanYieldsNoOutputs() {
        when(provider.send("scantxoutset", List.of("start", List.of("addr(" + ADDRESS + ")"))))
                .thenReturn(result(Map.of("success", true, "unspents", List.of())));

        assertTrue(network.listSpendableOutputs(ADDRESS).isEmpty());
    }

    @Test
    void convertsBtcPerKvbToSatPerVbyte() {
        when(provider.send("estimatesmartfee", List.of(BitcoinCoreNetwork.FEE_TARGET_BLOCKS)))
                .thenReturn(result(Map.of("feerate", new BigDecimal("0.00012345"), "blocks", 6)));

        final FeeRates rates = network.estimateFeeRate();

        assertEquals(13L, rates.normal());
        assertEquals(26L, rates.fastest());
        assertEquals(10L, rates.economical());
    }

    @Test
    void missingEstimateFallsBackToOneSatPerVbyte() {
        when(provider.send("estimatesmartfee", List.of(BitcoinCoreNetwork.FEE_TARGET_BLOCKS)))
                .thenReturn(result(Map.of("errors", List.of("Insufficient data or no feerate found"), "blocks", 0)));

        assertEquals(FeeRates.fromEstimate(1L), network.estimateFeeRate());
    }

    @Test
    void broadcastsHexAndReturnsNodeTxid() {
        when(provider.send("sendrawtransaction", List.of("0200ff"))).thenReturn(result(TXID));

        assertEquals(TXID, network.broadcast(new byte[] {0x02, 0x00, (byte) 0xff}));
    }

    @Test
    void mempoolTransactionHasNoConfirmations() {
        when(provider.send("getrawtransaction", List.of(TXID, true))).thenReturn(result(Map.of("txid", TXID)));

        assertEquals(0L, network.getConfirmations(TXID));
    }

    @Test
    void readsConfirmations() {
        when(provider.send("getrawtransaction", List.of(TXID, true)))
                .thenReturn(result(Map.of("txid", TXID, "confirmations", 3)));

        assertEquals(3L, network.getConfirmations(TXID));
    }

    @Test
    void rejectedBroadcastPropagates() {
        when(provider.send("sendrawtransaction", List.of("00")))
                .thenThrow(new RpcException(RpcException.RPC_VERIFY_REJECTED, "bad-txns-inputs-missingorspent", null, 4L));

        final RpcException ex = assertThrows(RpcException.class, () -> network.broadcast(new byte[] {0x00}));
        assertTrue(ex.isRejected());
    }

    @Test
    void healthReportsDownNode() {
        when(provider.send("getblockchaininfo", List.of()))
                .thenThrow(new RpcException(-32000, "Network error during JSON-RPC call", null, 1L));

        final NodeHealth health = network.health();

        assertFalse(health.ok());
        assertTrue(health.message().contains("Network error"));
    }

    @Test
    void healthReportsHeight() {
        when(provider.send("getblockchaininfo", List.of())).thenReturn(result(Map.of("blocks", 150)));

        assertEquals(NodeHealth.up(150L), network.health());
    }

    @Test
    void satoshiConversionsAreExact() {
        assertEquals(1L, BitcoinCoreNetwork.btcToSats(new BigDecimal("0.00000001")));
        assertEquals(2_100_000_000_000_000L, BitcoinCoreNetwork.btcToSats(new BigDecimal("21000000")));
        assertEquals(1L, BitcoinCoreNetwork.btcPerKvbToSatPerVbyte(new BigDecimal("0.00001000")));
        assertEquals(2L, BitcoinCoreNetwork.btcPerKvbToSatPerVbyte(new BigDecimal("0.00001001")));
    }

    private static JsonRpcResponse result(final Object result) {
        return new JsonRpcResponse(null, result, null, "1");
    }
}
