// file: storage/src/main/java/io/stow/storage/Store.java
package io.stow.storage;

import io.stow.core.Codec;
import io.stow.core.Decoder;
import io.stow.core.Encoder;
import io.stow.core.format.JsonCodec;
import io.stow.core.format.KryoCodec;
import io.stow.core.format.XmlCodec;
import io.stow.storage.engine.Bucket;
import io.stow.storage.engine.Transaction;
import io.stow.storage.engine.TransactionalEngine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Typed values persisted in one bucket of a transactional engine.
 * <p>
 * Responsibilities:
 *  - marshal values through the bound Codec before any transaction is opened,
 *  - run each operation in its own engine transaction, which makes the Store safe to share
 *    between threads,
 *  - unmarshal read bytes after the transaction has ended,
 *  - drive iteration through a {@link Dispatcher}.
 * <p>
 * Keys are raw bytes. The {@code *Key} variants accept any key: byte[] is used as is, a String
 * as its UTF-8 bytes, anything else is marshaled through the codec. Such keys only work with
 * codecs that produce the same bytes for equal keys, so unordered maps make poor keys.
 * <p>
 * Codec compatibility: the first write records the codec's fingerprint (primed state) for the
 * bucket in the reserved {@value #META_BUCKET} bucket. Later reads and writes through a codec
 * with a different fingerprint fail with {@link CodecMismatchException}.
 * <p>
 * forEach runs the callback inside a read transaction. A callback that writes through any
 * Store on the same engine deadlocks.
 */
public class Store {
    private static final Logger log = Logger.getLogger(Store.class.getName());

    static final String META_BUCKET = "stow.meta";

    private final TransactionalEngine engine;
    private final String bucket;
    private final Codec codec;

    public Store(TransactionalEngine engine, String bucket, Codec codec) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.codec = Objects.requireNonNull(codec, "codec");
        if (bucket.isBlank()) throw new IllegalArgumentException("bucket must not be blank");
        if (bucket.equals(META_BUCKET)) throw new IllegalArgumentException("bucket name is reserved: " + bucket);
    }

    /** Store using the binary format; classes travel with the data. */
    public static Store kryo(TransactionalEngine engine, String bucket) {
        return new Store(engine, bucket, new KryoCodec());
    }

    public static Store json(TransactionalEngine engine, String bucket) {
        return new Store(engine, bucket, new JsonCodec());
    }

    public static Store xml(TransactionalEngine engine, String bucket) {
        return new Store(engine, bucket, new XmlCodec());
    }

    /**
     * Store over a bucket nested in this one, sharing the codec.
     * Its records are invisible to this store's get/forEach; deleteAll here drops it too.
     */
    public Store nested(String child) {
        Objects.requireNonNull(child, "child");
        if (child.isBlank() || child.contains("/")) {
            throw new IllegalArgumentException("nested bucket name must be non-blank without '/': " + child);
        }
        return new Store(engine, bucket + "/" + child, codec);
    }

    public String bucket() {
        return bucket;
    }

    public Codec codec() {
        return codec;
    }

    /**
     * Store value under key, replacing any previous value.
     *
     * @throws MarshalException if the value cannot be encoded; nothing is written
     * @throws StorageException if the engine fails
     */
    public void put(byte[] key, Object value) {
        Objects.requireNonNull(key, "key");
        byte[] data = marshal(value);
        engine.update(tx -> {
            checkCodec(tx, true);
            tx.createBucketIfNotExists(bucket).put(key, data);
            return null;
        });
    }

    public void putKey(Object key, Object value) {
        put(toBytes(key), value);
    }

    /**
     * Read the value stored under key.
     *
     * @throws NotFoundException   if the key or the bucket is absent
     * @throws UnmarshalException if the bytes do not decode as {@code type}
     */
    public <T> T get(byte[] key, Class<T> type) {
        Objects.requireNonNull(key, "key");
        byte[] data = engine.view(tx -> {
            checkCodec(tx, false);
            Bucket objects = tx.bucket(bucket);
            if (objects == null) throw new NotFoundException(bucket, key);
            byte[] found = objects.get(key);
            if (found == null) throw new NotFoundException(bucket, key);
            return found;
        });
        return unmarshal(data, type);
    }

    public <T> T getKey(Object key, Class<T> type) {
        return get(toBytes(key), type);
    }

    /**
     * Read the value stored under key and remove it in the same transaction.
     * Two concurrent pulls of one key never both succeed.
     */
    public <T> T pull(byte[] key, Class<T> type) {
        Objects.requireNonNull(key, "key");
        byte[] data = engine.update(tx -> {
            checkCodec(tx, false);
            Bucket objects = tx.bucket(bucket);
            if (objects == null) throw new NotFoundException(bucket, key);
            byte[] found = objects.get(key);
            if (found == null) throw new NotFoundException(bucket, key);
            objects.delete(key);
            return found;
        });
        return unmarshal(data, type);
    }

    public <T> T pullKey(Object key, Class<T> type) {
        return pull(toBytes(key), type);
    }

    /** Remove key if present. */
    public void delete(byte[] key) {
        Objects.requireNonNull(key, "key");
        engine.update(tx -> {
            Bucket objects = tx.bucket(bucket);
            if (objects != null) objects.delete(key);
            return null;
        });
    }

    public void deleteKey(Object key) {
        delete(toBytes(key));
    }

    /**
     * Decode every record in key order and hand it to the dispatcher's callback.
     * A missing bucket is an empty store. The first record that fails to decode stops the scan
     * and its {@link UnmarshalException} is thrown; records before it were already delivered.
     */
    public void forEach(Dispatcher dispatcher) {
        Objects.requireNonNull(dispatcher, "dispatcher");
        engine.view(tx -> {
            checkCodec(tx, false);
            Bucket objects = tx.bucket(bucket);
            if (objects == null) return null;
            objects.forEach((k, v) -> dispatcher.dispatch(this, k, v));
            return null;
        });
    }

    public <V> void forEach(Class<V> valueType, Consumer<? super V> callback) {
        forEach(Dispatcher.values(valueType, callback));
    }

    public <K, V> void forEach(Class<K> keyType, Class<V> valueType, BiConsumer<? super K, ? super V> callback) {
        forEach(Dispatcher.entries(keyType, valueType, callback));
    }

    /** Drop the bucket and everything nested in it. Dropping an absent bucket succeeds. */
    public void deleteAll() {
        engine.update(tx -> {
            Bucket meta = tx.bucket(META_BUCKET);
            if (meta != null) {
                String prefix = bucket + "/";
                List<byte[]> stale = new ArrayList<>();
                meta.forEach((k, v) -> {
                    String name = new String(k, StandardCharsets.UTF_8);
                    if (name.equals(bucket) || name.startsWith(prefix)) stale.add(k);
                });
                stale.forEach(meta::delete);
            }
            boolean existed = tx.deleteBucket(bucket);
            if (existed) log.fine(() -> "dropped bucket " + bucket);
            return null;
        });
    }

    byte[] marshal(Object value) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(256);
        Encoder encoder = codec.newEncoder(buf);
        try {
            encoder.encode(value);
        } catch (IOException e) {
            // A failed encoder may hold partial state; it is dropped rather than released.
            throw new MarshalException("Cannot encode " + describe(value) + ": " + e.getMessage(), e);
        }
        codec.release(encoder);
        return buf.toByteArray();
    }

    <T> T unmarshal(byte[] data, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Decoder decoder = codec.newDecoder(new ByteArrayInputStream(data));
        T value;
        try {
            value = decoder.decode(Types.boxed(type));
        } catch (IOException e) {
            throw new UnmarshalException("Cannot decode " + type.getName() + " from bucket '" + bucket + "': " + e.getMessage(), e);
        }
        codec.release(decoder);
        return value;
    }

    byte[] toBytes(Object key) {
        Objects.requireNonNull(key, "key");
        if (key instanceof byte[]) return (byte[]) key;
        if (key instanceof String) return ((String) key).getBytes(StandardCharsets.UTF_8);
        return marshal(key);
    }

    /**
     * Compare the codec marker recorded for this bucket with ours.
     * An empty marker stands for a codec without a fingerprint.
     */
    private void checkCodec(Transaction tx, boolean recordIfAbsent) {
        byte[] mine = marker(codec.fingerprint());
        byte[] name = bucket.getBytes(StandardCharsets.UTF_8);
        Bucket meta = recordIfAbsent ? tx.createBucketIfNotExists(META_BUCKET) : tx.bucket(META_BUCKET);
        if (meta == null) return;
        byte[] stored = meta.get(name);
        if (stored == null) {
            if (recordIfAbsent) meta.put(name, mine);
            return;
        }
        if (!Arrays.equals(stored, mine)) {
            throw new CodecMismatchException(bucket, describeMarker(stored), describeMarker(mine));
        }
    }

    private static byte[] marker(OptionalLong fingerprint) {
        if (fingerprint.isEmpty()) return new byte[0];
        return ByteBuffer.allocate(Long.BYTES).putLong(fingerprint.getAsLong()).array();
    }

    private static String describeMarker(byte[] marker) {
        if (marker.length != Long.BYTES) return "without fingerprint";
        return String.format("fingerprint %08x", ByteBuffer.wrap(marker).getLong());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
