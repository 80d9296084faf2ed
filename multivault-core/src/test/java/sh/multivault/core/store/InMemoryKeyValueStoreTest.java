// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.multivault.core.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Test
    void putGetDelete() {
        store.put("wallet:a", new byte[] {1, 2});

        assertArrayEquals(new byte[] {1, 2}, store.get("wallet:a").orElseThrow());

        store.delete("wallet:a");
        assertTrue(store.get("wallet:a").isEmpty());
    }

    @Test
    void deletingAbsentKeyIsNoOp() {
        store.delete("tx:missing");

        assertEquals(0, store.size());
    }

    @Test
    void storedValuesAreCopies() {
        final byte[] value = {7};
        store.put("tx:a", value);
        value[0] = 9;

        store.get("tx:a").orElseThrow()[0] = 5;

        assertArrayEquals(new byte[] {7}, store.get("tx:a").orElseThrow());
    }

    @Test
    void prefixScanStaysInNamespace() {
        store.put("tx:b", new byte[0]);
        store.put("tx:a", new byte[0]);
        store.put("wallet:a", new byte[0]);
        store.put("txn:other", new byte[0]);

        assertEquals(List.of("tx:a", "tx:b"), store.getKeysWithPrefix(StoreKeys.TRANSACTION_PREFIX));
        assertEquals(List.of("wallet:a"), store.getKeysWithPrefix(StoreKeys.WALLET_PREFIX));
    }

    @Test
    void keysStripToIds() {
        assertEquals("abc", StoreKeys.idOf(StoreKeys.transaction("abc")));
        assertEquals("w1", StoreKeys.idOf(StoreKeys.wallet("w1")));
    }
}
