// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.network;

import java.util.List;
import sh.multivault.core.model.FeeRates;
import sh.multivault.core.model.NodeHealth;
import sh.multivault.core.model.Utxo;

/**
 * Bitcoin network access used for funding, fee estimation, broadcast and confirmation
 * lookups.
 *
 * <p>
 * Calls may block on I/O. Failures, including timeouts, are reported as unchecked
 * exceptions; the engine surfaces them as
 * {@link sh.multivault.core.error.ExternalServiceException} and commits no state for the call.
 *
 * @since 0.1.0
 */
public interface FundingNetwork {

    /**
     * Unspent outputs currently paying to {@code address}.
     */
    List<Utxo> listSpendableOutputs(String address);

    /**
     * Current fee-rate tiers in sat/vB.
     */
    FeeRates estimateFeeRate();

    /**
     * Submits a fully signed raw transaction.
     *
     * @return the network transaction id
     */
    String broadcast(byte[] rawTransaction);

    /**
     * Confirmation count of a broadcast transaction, 0 while unconfirmed.
     */
    long getConfirmations(String networkTxId);

    NodeHealth health();
}
