// file: storage/src/main/java/io/stow/storage/engine/TransactionalEngine.java
package io.stow.storage.engine;

/**
 * Embedded, ordered, transactional byte store that a Store runs its operations against.
 * <p>
 * Contract:
 *  - update() runs work in a read/write transaction. It commits when the work returns and rolls
 *    back when the work throws; the exception is then rethrown to the caller.
 *  - view() runs work in a read-only transaction.
 *  - Single writer, many readers: updates are serialized against each other and against views.
 * <p>
 * Work that starts another update on the same engine from inside a transaction deadlocks.
 */
public interface TransactionalEngine extends AutoCloseable {

    <T> T update(TransactionWork<T> work);

    <T> T view(TransactionWork<T> work);

    @Override
    void close();

    /**
     * Body of a transaction. The transaction handle is only valid while run() executes.
     */
    @FunctionalInterface
    interface TransactionWork<T> {
        T run(Transaction tx);
    }
}
