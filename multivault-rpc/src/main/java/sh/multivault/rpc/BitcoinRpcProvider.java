// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.rpc;

import java.util.List;

/**
 * Low-level transport for JSON-RPC requests to a Bitcoin Core node.
 *
 * <p>
 * Implementations handle serialization, the wire protocol and error mapping. There are no
 * retries.
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe.
 *
 * @see HttpBitcoinRpcProvider
 * @see BitcoinCoreNetwork
 */
public interface BitcoinRpcProvider extends AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the RPC method name, e.g. {@code getblockchaininfo}
     * @param params positional parameters
     * @return the response, never one carrying an error
     * @throws RpcException if the request fails or the node returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    static BitcoinRpcProvider http(final String url) {
        return HttpBitcoinRpcProvider.builder(url).build();
    }

    @Override
    default void close() {
    }
}
