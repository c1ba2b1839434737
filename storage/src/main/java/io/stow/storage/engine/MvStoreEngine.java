// file: storage/src/main/java/io/stow/storage/engine/MvStoreEngine.java
package io.stow.storage.engine;

import io.stow.storage.StorageException;
import io.stow.storage.StowException;
import org.h2.mvstore.Cursor;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TransactionalEngine backed by an H2 MVStore.
 * <p>
 * Layout:
 *  - one MVMap per bucket, named after the bucket;
 *  - nested buckets are maps named "parent/child";
 *  - keys are stored as ISO-8859-1 strings, one char per byte, so the map's string order is the
 *    unsigned byte order of the original keys.
 * <p>
 * Transactions:
 *  - auto-commit is off; update() ends with MVStore.commit() or, on any exception, MVStore.rollback();
 *  - a ReentrantReadWriteLock gives single-writer / many-reader semantics: update() holds the
 *    write lock, view() the read lock, so readers never see uncommitted changes.
 * <p>
 * Dropping a bucket removes its maps immediately and is not undone by a rollback, so deleteBucket
 * should be the last write of its transaction.
 */
public final class MvStoreEngine implements TransactionalEngine {
    private static final Logger log = Logger.getLogger(MvStoreEngine.class.getName());

    private final MVStore store;
    private final String description;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private MvStoreEngine(MVStore store, String description) {
        this.store = store;
        this.description = description;
    }

    public static MvStoreEngine open(EngineConfig config) {
        Objects.requireNonNull(config, "config");
        MVStore.Builder builder = new MVStore.Builder()
                .autoCommitDisabled()
                .cacheSize(config.cacheSizeMb());
        if (!config.isInMemory()) builder.fileName(config.path().toString());
        if (config.compress()) builder.compress();
        if (config.readOnly()) builder.readOnly();

        String description = config.isInMemory() ? "in-memory" : config.path().toString();
        try {
            MVStore store = builder.open();
            log.info(() -> "opened engine " + description);
            return new MvStoreEngine(store, description);
        } catch (MVStoreException e) {
            throw new StorageException("Failed to open engine " + description, e);
        }
    }

    public static MvStoreEngine inMemory() {
        return open(EngineConfig.inMemory());
    }

    @Override
    public <T> T update(TransactionWork<T> work) {
        Objects.requireNonNull(work, "work");
        lock.writeLock().lock();
        try {
            ensureOpen();
            try {
                T result = work.run(new MvTransaction(true));
                store.commit();
                return result;
            } catch (RuntimeException e) {
                try {
                    store.rollback();
                } catch (RuntimeException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw translate(e);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T view(TransactionWork<T> work) {
        Objects.requireNonNull(work, "work");
        lock.readLock().lock();
        try {
            ensureOpen();
            try {
                return work.run(new MvTransaction(false));
            } catch (RuntimeException e) {
                throw translate(e);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!store.isClosed()) {
                store.close();
                log.info(() -> "closed engine " + description);
            }
        } catch (MVStoreException e) {
            throw new StorageException("Failed to close engine " + description, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        return store.isClosed();
    }

    private void ensureOpen() {
        if (store.isClosed()) {
            throw new StorageException("engine " + description + " is closed");
        }
    }

    /** Our own errors pass through; engine failures become StorageException. */
    private RuntimeException translate(RuntimeException e) {
        if (e instanceof StowException) {
            return e;
        }
        if (e instanceof MVStoreException) {
            log.log(Level.WARNING, "transaction on " + description + " rolled back", e);
            return new StorageException("Transaction failed on " + description + ": " + e.getMessage(), e);
        }
        return e;
    }

    static String keyOf(byte[] key) {
        return new String(key, StandardCharsets.ISO_8859_1);
    }

    static byte[] bytesOf(String key) {
        return key.getBytes(StandardCharsets.ISO_8859_1);
    }

    private final class MvTransaction implements Transaction {
        private final boolean writable;

        MvTransaction(boolean writable) {
            this.writable = writable;
        }

        @Override
        public Bucket bucket(String name) {
            Objects.requireNonNull(name, "name");
            if (!store.hasMap(name)) {
                return null;
            }
            return new MvBucket(store.openMap(name), writable);
        }

        @Override
        public Bucket createBucketIfNotExists(String name) {
            Objects.requireNonNull(name, "name");
            requireWritable();
            return new MvBucket(store.openMap(name), true);
        }

        @Override
        public boolean deleteBucket(String name) {
            Objects.requireNonNull(name, "name");
            requireWritable();
            String prefix = name + "/";
            List<String> nested = new ArrayList<>();
            for (String mapName : store.getMapNames()) {
                if (mapName.startsWith(prefix)) nested.add(mapName);
            }
            for (String mapName : nested) {
                store.removeMap(mapName);
            }
            if (!store.hasMap(name)) {
                return false;
            }
            store.removeMap(name);
            return true;
        }

        @Override
        public boolean writable() {
            return writable;
        }

        private void requireWritable() {
            if (!writable) throw new IllegalStateException("read-only transaction");
        }
    }

    private static final class MvBucket implements Bucket {
        private final MVMap<String, byte[]> map;
        private final boolean writable;

        MvBucket(MVMap<String, byte[]> map, boolean writable) {
            this.map = map;
            this.writable = writable;
        }

        @Override
        public byte[] get(byte[] key) {
            byte[] value = map.get(keyOf(key));
            return value == null ? null : Arrays.copyOf(value, value.length);
        }

        @Override
        public void put(byte[] key, byte[] value) {
            requireWritable();
            Objects.requireNonNull(value, "value");
            map.put(keyOf(key), Arrays.copyOf(value, value.length));
        }

        @Override
        public void delete(byte[] key) {
            requireWritable();
            map.remove(keyOf(key));
        }

        @Override
        public void forEach(RecordVisitor visitor) {
            Cursor<String, byte[]> cursor = map.cursor(null);
            while (cursor.hasNext()) {
                String key = cursor.next();
                byte[] value = cursor.getValue();
                visitor.visit(bytesOf(key), Arrays.copyOf(value, value.length));
            }
        }

        private void requireWritable() {
            if (!writable) throw new IllegalStateException("read-only transaction");
        }
    }
}
