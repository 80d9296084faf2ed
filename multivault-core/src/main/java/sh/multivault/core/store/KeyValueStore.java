// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Opaque key/value persistence supplied by the host application.
 *
 * <p>
 * Keys follow the {@code wallet:<id>} and {@code tx:<id>} namespaces (see {@link StoreKeys});
 * values are opaque bytes. Implementations must be thread-safe. A failing implementation
 * should throw an unchecked exception, which callers surface as an external-service failure.
 *
 * @since 0.1.0
 */
public interface KeyValueStore {

    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    /**
     * Removes {@code key}. Removing an absent key is a no-op.
     */
    void delete(String key);

    /**
     * All keys starting with {@code prefix}, in ascending key order.
     */
    List<String> getKeysWithPrefix(String prefix);
}
