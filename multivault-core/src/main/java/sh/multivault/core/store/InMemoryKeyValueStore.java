// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe {@link KeyValueStore} held in memory. Values are copied on the way in and out.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentSkipListMap<String, byte[]> entries = new ConcurrentSkipListMap<>();

    @Override
    public Optional<byte[]> get(final String key) {
        final byte[] value = entries.get(Objects.requireNonNull(key, "key"));
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void put(final String key, final byte[] value) {
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value").clone());
    }

    @Override
    public void delete(final String key) {
        entries.remove(Objects.requireNonNull(key, "key"));
    }

    @Override
    public List<String> getKeysWithPrefix(final String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        final List<String> keys = new ArrayList<>();
        for (String key : entries.tailMap(prefix, true).keySet()) {
            if (!key.startsWith(prefix)) {
                break;
            }
            keys.add(key);
        }
        return keys;
    }

    public int size() {
        return entries.size();
    }
}
