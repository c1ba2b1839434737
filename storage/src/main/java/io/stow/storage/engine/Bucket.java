package io.stow.storage.engine;

/**
 * Named, byte-ordered key/value namespace inside a transaction.
 * Keys are compared as unsigned bytes. Arrays passed in or handed out are never shared with the engine.
 */
public interface Bucket {

    /** @return the stored bytes, or null if the key is absent */
    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    /** Remove the key; absent keys are ignored. */
    void delete(byte[] key);

    /**
     * Visit every record in key order. A visitor aborts the scan by throwing; the exception
     * propagates out of forEach and rolls the transaction back.
     */
    void forEach(RecordVisitor visitor);

    @FunctionalInterface
    interface RecordVisitor {
        void visit(byte[] key, byte[] value);
    }
}
