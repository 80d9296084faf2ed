// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.multivault.core.model.FeeRates;
import sh.multivault.core.model.NodeHealth;
import sh.multivault.core.model.Utxo;
import sh.multivault.core.network.FundingNetwork;
import sh.multivault.primitives.Hex;

/**
 * {@link FundingNetwork} backed by a Bitcoin Core node.
 *
 * <p>
 * Funding outputs come from {@code scantxoutset}, so the node needs no wallet or address
 * index. Confirmations come from {@code getrawtransaction} in verbose mode, which requires
 * {@code -txindex} for transactions that have left the mempool.
 */
public final class BitcoinCoreNetwork implements FundingNetwork {

    private static final Logger LOG = LoggerFactory.getLogger(BitcoinCoreNetwork.class);

    static final int FEE_TARGET_BLOCKS = 6;
    private static final BigDecimal SATS_PER_BTC = BigDecimal.valueOf(100_000_000L);
    private static final BigDecimal VBYTES_PER_KVB = BigDecimal.valueOf(1_000L);

    private final BitcoinRpcProvider provider;

    public BitcoinCoreNetwork(final BitcoinRpcProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public List<Utxo> listSpendableOutputs(final String address) {
        final JsonRpcResponse response = provider.send(
                "scantxoutset", List.of("start", List.of("addr(" + address + ")")));
        final Map<String, Object> result = requireMap("scantxoutset", response);
        final Object unspents = result.get("unspents");
        final List<Utxo> utxos = new ArrayList<>();
        if (!(unspents instanceof List<?>)) {
            return utxos;
        }
        for (Object entry : (List<?>) unspents) {
            final Map<?, ?> unspent = (Map<?, ?>) entry;
            utxos.add(new Utxo(
                    String.valueOf(unspent.get("txid")),
                    ((Number) unspent.get("vout")).intValue(),
                    btcToSats(unspent.get("amount"))));
        }
        return utxos;
    }

    /**
     * Fee tiers from {@code estimatesmartfee}. When the node has too little data to estimate,
     * the tiers fall back to 1 sat/vB.
     */
    @Override
    public FeeRates estimateFeeRate() {
        final Map<String, Object> result =
                requireMap("estimatesmartfee", provider.send("estimatesmartfee", List.of(FEE_TARGET_BLOCKS)));
        final Object feerate = result.get("feerate");
        if (feerate == null) {
            LOG.warn("estimatesmartfee returned no estimate: {}", result.get("errors"));
            return FeeRates.fromEstimate(1L);
        }
        return FeeRates.fromEstimate(btcPerKvbToSatPerVbyte(feerate));
    }

    @Override
    public String broadcast(final byte[] rawTransaction) {
        final String txid = provider.send("sendrawtransaction", List.of(Hex.encodeNoPrefix(rawTransaction)))
                .resultAsString();
        if (txid == null) {
            throw new RpcException(-32700, "sendrawtransaction returned no txid", null, null);
        }
        return txid;
    }

    @Override
    public long getConfirmations(final String networkTxId) {
        final Map<String, Object> result =
                requireMap("getrawtransaction", provider.send("getrawtransaction", List.of(networkTxId, true)));
        final Object confirmations = result.get("confirmations");
        return confirmations instanceof Number ? ((Number) confirmations).longValue() : 0L;
    }

    /**
     * Chain height from {@code getblockchaininfo}. Transport failures are reported as a down
     * node rather than thrown.
     */
    @Override
    public NodeHealth health() {
        try {
            final Map<String, Object> result =
                    requireMap("getblockchaininfo", provider.send("getblockchaininfo", List.of()));
            return NodeHealth.up(((Number) result.get("blocks")).longValue());
        } catch (RpcException e) {
            LOG.warn("Bitcoin node health check failed: {}", e.getMessage());
            return NodeHealth.down(e.getMessage());
        }
    }

    static long btcToSats(final Object amount) {
        return new BigDecimal(String.valueOf(amount))
                .multiply(SATS_PER_BTC)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    static long btcPerKvbToSatPerVbyte(final Object feerate) {
        return new BigDecimal(String.valueOf(feerate))
                .multiply(SATS_PER_BTC)
                .divide(VBYTES_PER_KVB, 0, RoundingMode.CEILING)
                .longValueExact();
    }

    private static Map<String, Object> requireMap(final String method, final JsonRpcResponse response) {
        final Map<String, Object> result = response.resultAsMap();
        if (result == null) {
            throw new RpcException(-32700, method + " returned no result", null, null);
        }
        return result;
    }
}
