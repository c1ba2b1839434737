package io.stow.storage;

import io.stow.core.Codec;
import io.stow.core.PooledCodec;
import io.stow.core.PrimedCodec;
import io.stow.core.format.JsonCodec;
import io.stow.core.format.KryoCodec;
import io.stow.core.format.XmlCodec;
import io.stow.storage.engine.MvStoreEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior that must hold for every codec:
 * - put/get returns an equal value,
 * - forEach visits records in key order with keys as bytes, text or decoded values,
 * - get/pull on absent keys raise NotFoundException,
 * - deleteAll leaves an empty store behind.
 */
class StoreTest {

    private MvStoreEngine engine;

    @BeforeEach
    void open() {
        engine = MvStoreEngine.inMemory();
    }

    @AfterEach
    void close() {
        engine.close();
    }

    static Stream<Arguments> codecs() throws IOException {
        return Stream.of(
                Arguments.of("kryo", new KryoCodec()),
                Arguments.of("json", new JsonCodec()),
                Arguments.of("xml", new XmlCodec()),
                Arguments.of("primed kryo", PrimedCodec.prime(new KryoCodec(), new Person())),
                Arguments.of("pooled primed kryo", new PooledCodec(PrimedCodec.prime(new KryoCodec(), new Person())))
        );
    }

    private static byte[] k(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void put_then_get_returns_equal_value(String name, Codec codec) {
        var store = new Store(engine, "people", codec);
        var ada = new Person("Ada", "Lovelace", 36);

        store.put(k("ada"), ada);

        assertEquals(ada, store.get(k("ada"), Person.class));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void put_replaces_previous_value(String name, Codec codec) {
        var store = new Store(engine, "people", codec);

        store.put(k("p"), new Person("Ada", "Lovelace", 36));
        store.put(k("p"), new Person("Grace", "Hopper", 85));

        assertEquals("Grace", store.get(k("p"), Person.class).getFirstName());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void for_each_visits_values_in_key_order(String name, Codec codec) {
        var store = new Store(engine, "people", codec);
        store.put(k("b"), new Person("Bea", "B", 2));
        store.put(k("a"), new Person("Al", "A", 1));
        store.put(k("c"), new Person("Cy", "C", 3));

        List<String> seen = new ArrayList<>();
        store.forEach(Person.class, p -> seen.add(p.getFirstName()));

        assertEquals(List.of("Al", "Bea", "Cy"), seen);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void for_each_hands_raw_and_text_keys(String name, Codec codec) {
        var store = new Store(engine, "people", codec);
        var ada = new Person("Ada", "Lovelace", 36);
        store.put(k("k"), ada);

        Map<String, Person> byText = new LinkedHashMap<>();
        store.forEach(String.class, Person.class, byText::put);
        assertEquals(Map.of("k", ada), byText);

        List<byte[]> rawKeys = new ArrayList<>();
        store.forEach(byte[].class, Person.class, (key, p) -> rawKeys.add(key));
        assertEquals(1, rawKeys.size());
        assertArrayEquals(k("k"), rawKeys.get(0));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void object_keys_are_marshaled_and_decoded_back(String name, Codec codec) {
        var store = new Store(engine, "people", codec);
        var key = new Person("Key", "Holder", 1);
        var value = new Person("Val", "Holder", 2);

        store.putKey(key, value);

        assertEquals(value, store.getKey(key, Person.class));
        List<Person> keys = new ArrayList<>();
        store.forEach(Person.class, Person.class, (kp, vp) -> keys.add(kp));
        assertEquals(List.of(key), keys);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void missing_key_and_missing_bucket_are_not_found(String name, Codec codec) {
        var store = new Store(engine, "people", codec);

        assertThrows(NotFoundException.class, () -> store.get(k("nobody"), Person.class));

        store.put(k("ada"), new Person("Ada", "Lovelace", 36));
        var e = assertThrows(NotFoundException.class, () -> store.get(k("nobody"), Person.class));
        assertEquals("people", e.bucket());
        assertTrue(e.getMessage().contains("\"nobody\""), e.getMessage());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void pull_returns_value_and_removes_it(String name, Codec codec) {
        var store = new Store(engine, "people", codec);
        var ada = new Person("Ada", "Lovelace", 36);
        store.put(k("ada"), ada);

        assertEquals(ada, store.pull(k("ada"), Person.class));
        assertThrows(NotFoundException.class, () -> store.get(k("ada"), Person.class));
        assertThrows(NotFoundException.class, () -> store.pull(k("ada"), Person.class));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codecs")
    void delete_all_then_for_each_sees_nothing(String name, Codec codec) {
        var store = new Store(engine, "people", codec);
        store.put(k("a"), new Person("Al", "A", 1));
        store.put(k("b"), new Person("Bea", "B", 2));

        store.deleteAll();

        assertThrows(NotFoundException.class, () -> store.get(k("a"), Person.class));
        assertThrows(NotFoundException.class, () -> store.pull(k("b"), Person.class));
        List<Person> seen = new ArrayList<>();
        store.forEach(Person.class, seen::add);
        assertTrue(seen.isEmpty());
        // Dropping an absent bucket is fine.
        assertDoesNotThrow(store::deleteAll);
    }

    @Test
    void primed_kryo_scenario_round_trips_person() throws IOException {
        var store = new Store(engine, "people", PrimedCodec.prime(new KryoCodec(), new Person()));

        store.put(k("a"), new Person("X", null, 0));

        assertEquals(new Person("X", null, 0), store.get(k("a"), Person.class));
    }

    /** Type left out of the primed sample set. */
    public static class Address {
        private String street;

        public Address() {
        }

        public Address(String street) {
            this.street = street;
        }

        public String getStreet() { return street; }
        public void setStreet(String street) { this.street = street; }
    }

    @Test
    void pooled_primed_store_reads_back_types_outside_the_primed_set() throws IOException {
        var pooled = new PooledCodec(PrimedCodec.prime(new KryoCodec(), new Person()));
        var store = new Store(engine, "addr", pooled);

        store.put(k("a"), new Address("first"));
        store.put(k("b"), new Address("second"));
        store.put(k("c"), new Person("Ada", "Lovelace", 36));

        assertEquals("second", store.get(k("b"), Address.class).getStreet());
        assertEquals("first", store.get(k("a"), Address.class).getStreet());
        assertEquals("second", store.get(k("b"), Address.class).getStreet());
        assertEquals(new Person("Ada", "Lovelace", 36), store.get(k("c"), Person.class));

        var fresh = new Store(engine, "addr", PrimedCodec.prime(new KryoCodec(), new Person()));
        List<String> streets = new ArrayList<>();
        fresh.forEach(byte[].class, Object.class, (key, v) -> {
            if (v instanceof Address) streets.add(((Address) v).getStreet());
        });
        assertEquals(List.of("first", "second"), streets);
        assertTrue(pooled.droppedInstances() > 0, "drifted instances are not recycled");
    }

    @Test
    void for_each_on_empty_bucket_never_calls_back() {
        var store = Store.kryo(engine, "empty");
        int[] calls = {0};

        store.forEach(Person.class, p -> calls[0]++);

        assertEquals(0, calls[0]);
    }

    @Test
    void delete_is_idempotent() {
        var store = Store.json(engine, "people");
        store.put(k("a"), new Person("Al", "A", 1));

        store.delete(k("a"));
        store.delete(k("a"));
        store.delete(k("never"));

        assertThrows(NotFoundException.class, () -> store.get(k("a"), Person.class));
    }

    @Test
    void string_keys_match_their_utf8_bytes() {
        var store = Store.json(engine, "words");
        store.putKey("grüße", "hello");

        assertEquals("hello", store.get("grüße".getBytes(StandardCharsets.UTF_8), String.class));
        assertEquals("hello", store.pullKey("grüße", String.class));
        assertThrows(NotFoundException.class, () -> store.getKey("grüße", String.class));
    }

    @Test
    void decoding_into_the_wrong_type_is_an_unmarshal_error() {
        var store = Store.kryo(engine, "people");
        store.put(k("a"), new Person("Al", "A", 1));

        assertThrows(UnmarshalException.class, () -> store.get(k("a"), String.class));
    }

    @Test
    void corrupt_record_aborts_for_each_with_unmarshal_error() {
        var store = Store.json(engine, "people");
        store.put(k("a"), new Person("Al", "A", 1));
        engine.update(tx -> {
            tx.bucket("people").put(k("b"), k("{not json"));
            return null;
        });
        store.put(k("c"), new Person("Cy", "C", 3));

        List<String> seen = new ArrayList<>();
        assertThrows(UnmarshalException.class,
                () -> store.forEach(Person.class, p -> seen.add(p.getFirstName())));
        assertEquals(List.of("Al"), seen, "records before the corrupt one were delivered");
    }

    @Test
    void unregistered_type_under_strict_kryo_is_a_marshal_error_and_writes_nothing() {
        var store = new Store(engine, "people", KryoCodec.strict(new io.stow.core.TypeRegistry()));

        var e = assertThrows(MarshalException.class, () -> store.put(k("a"), new Person("Al", "A", 1)));
        assertTrue(e.getMessage().contains(Person.class.getName()), e.getMessage());
        assertNull(engine.view(tx -> tx.bucket("people")));
    }

    @Test
    void primitive_decode_target_is_boxed() {
        var store = Store.json(engine, "numbers");
        store.put(k("n"), 42);

        Integer n = store.get(k("n"), int.class);
        assertEquals(Integer.valueOf(42), n);
    }

    @Test
    void bucket_name_is_validated() {
        assertThrows(IllegalArgumentException.class, () -> Store.json(engine, " "));
        assertThrows(IllegalArgumentException.class, () -> Store.json(engine, Store.META_BUCKET));
        var store = Store.json(engine, "people");
        assertThrows(IllegalArgumentException.class, () -> store.nested("a/b"));
    }

    @Test
    void concurrent_pulls_of_one_key_succeed_once() throws Exception {
        var store = Store.json(engine, "queue");
        store.put(k("job"), "payload");

        int threads = 8;
        var pool = java.util.concurrent.Executors.newFixedThreadPool(threads);
        var start = new java.util.concurrent.CountDownLatch(1);
        List<java.util.concurrent.Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    store.pull(k("job"), String.class);
                    return true;
                } catch (NotFoundException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int winners = 0;
        for (var f : results) {
            if (f.get()) winners++;
        }
        pool.shutdown();
        assertEquals(1, winners);
    }
}
