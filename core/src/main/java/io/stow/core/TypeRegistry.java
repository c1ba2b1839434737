package io.stow.core;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered set of classes registered for binary formats that assign numeric type ids.
 * <p>
 * Registration order decides the ids, so every process reading the same data must register the
 * same classes in the same order before creating codecs. Codecs snapshot the list when they
 * build an encoder or decoder; registering later does not affect instances that already exist.
 */
public final class TypeRegistry {
    private static final TypeRegistry GLOBAL = new TypeRegistry();

    private final List<Class<?>> types = new CopyOnWriteArrayList<>();

    /** The process-wide registry used by codecs that are not given one explicitly. */
    public static TypeRegistry global() {
        return GLOBAL;
    }

    /** Register {@code type}; registering it again keeps its original position. */
    public synchronized TypeRegistry register(Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (type.isPrimitive() || type.isInterface()) {
            throw new IllegalArgumentException("only concrete classes can be registered: " + type.getName());
        }
        if (!types.contains(type)) {
            types.add(type);
        }
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return types.contains(type);
    }

    /** Registered classes in registration order. */
    public List<Class<?>> types() {
        return List.copyOf(types);
    }
}
