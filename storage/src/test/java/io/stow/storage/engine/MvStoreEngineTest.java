package io.stow.storage.engine;

import io.stow.storage.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine contract checks:
 * - update commits on return and rolls back on exception,
 * - buckets iterate in unsigned byte order,
 * - committed data survives close/reopen of a file store.
 */
class MvStoreEngineTest {

    private static byte[] b(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) out[i] = (byte) values[i];
        return out;
    }

    private static byte[] s(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void committed_update_is_visible_to_view() {
        try (var engine = MvStoreEngine.inMemory()) {
            engine.update(tx -> {
                tx.createBucketIfNotExists("b").put(s("k"), s("v"));
                return null;
            });

            byte[] read = engine.view(tx -> tx.bucket("b").get(s("k")));
            assertArrayEquals(s("v"), read);
        }
    }

    @Test
    void failing_update_rolls_back_its_writes() {
        try (var engine = MvStoreEngine.inMemory()) {
            engine.update(tx -> {
                tx.createBucketIfNotExists("b").put(s("k"), s("old"));
                return null;
            });

            var e = assertThrows(IllegalStateException.class, () -> engine.update(tx -> {
                Bucket bucket = tx.bucket("b");
                bucket.put(s("k"), s("new"));
                bucket.put(s("other"), s("x"));
                throw new IllegalStateException("abort");
            }));
            assertEquals("abort", e.getMessage());

            assertArrayEquals(s("old"), engine.view(tx -> tx.bucket("b").get(s("k"))));
            assertNull(engine.view(tx -> tx.bucket("b").get(s("other"))));
        }
    }

    @Test
    void keys_iterate_in_unsigned_byte_order() {
        try (var engine = MvStoreEngine.inMemory()) {
            engine.update(tx -> {
                Bucket bucket = tx.createBucketIfNotExists("b");
                bucket.put(b(0xff), s("ff"));
                bucket.put(b(0x80), s("80"));
                bucket.put(b(0x01, 0x00), s("0100"));
                bucket.put(b(0x7f), s("7f"));
                bucket.put(b(0x01), s("01"));
                return null;
            });

            List<String> order = new ArrayList<>();
            engine.view(tx -> {
                tx.bucket("b").forEach((k, v) -> order.add(new String(v, StandardCharsets.UTF_8)));
                return null;
            });
            assertEquals(List.of("01", "0100", "7f", "80", "ff"), order);
        }
    }

    @Test
    void returned_arrays_are_copies() {
        try (var engine = MvStoreEngine.inMemory()) {
            byte[] value = s("abc");
            engine.update(tx -> {
                tx.createBucketIfNotExists("b").put(s("k"), value);
                return null;
            });
            value[0] = 'z';

            byte[] first = engine.view(tx -> tx.bucket("b").get(s("k")));
            first[1] = 'z';

            assertArrayEquals(s("abc"), engine.view(tx -> tx.bucket("b").get(s("k"))));
        }
    }

    @Test
    void delete_bucket_drops_nested_buckets_and_tolerates_absent_ones() {
        try (var engine = MvStoreEngine.inMemory()) {
            engine.update(tx -> {
                tx.createBucketIfNotExists("parent").put(s("k"), s("v"));
                tx.createBucketIfNotExists("parent/child").put(s("k"), s("v"));
                tx.createBucketIfNotExists("parentless").put(s("k"), s("v"));
                return null;
            });

            boolean dropped = engine.update(tx -> tx.deleteBucket("parent"));
            boolean droppedAgain = engine.update(tx -> tx.deleteBucket("parent"));
            assertTrue(dropped);
            assertFalse(droppedAgain);

            assertNull(engine.view(tx -> tx.bucket("parent")));
            assertNull(engine.view(tx -> tx.bucket("parent/child")));
            assertNotNull(engine.view(tx -> tx.bucket("parentless")), "sibling with a shared prefix survives");
        }
    }

    @Test
    void view_rejects_writes() {
        try (var engine = MvStoreEngine.inMemory()) {
            engine.update(tx -> tx.createBucketIfNotExists("b"));

            assertThrows(IllegalStateException.class, () -> engine.view(tx -> tx.createBucketIfNotExists("c")));
            assertThrows(IllegalStateException.class, () -> engine.view(tx -> {
                tx.bucket("b").put(s("k"), s("v"));
                return null;
            }));
            boolean writable = engine.view(Transaction::writable);
            assertFalse(writable);
        }
    }

    @Test
    void committed_data_survives_reopen(@TempDir Path dir) {
        Path file = dir.resolve("stow.mv.db");

        try (var engine = MvStoreEngine.open(EngineConfig.file(file))) {
            engine.update(tx -> {
                tx.createBucketIfNotExists("b").put(s("k"), s("durable"));
                return null;
            });
        }

        try (var engine = MvStoreEngine.open(EngineConfig.file(file))) {
            assertArrayEquals(s("durable"), engine.view(tx -> tx.bucket("b").get(s("k"))));
        }
    }

    @Test
    void closed_engine_raises_storage_exception() {
        var engine = MvStoreEngine.inMemory();
        engine.close();

        assertTrue(engine.isClosed());
        assertThrows(StorageException.class, () -> engine.view(tx -> null));
        assertThrows(StorageException.class, () -> engine.update(tx -> null));
        assertDoesNotThrow(engine::close);
    }
}
