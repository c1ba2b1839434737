package io.stow.storage;

import java.util.Map;

/** Primitive handling for decode targets. */
final class Types {
    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            char.class, Character.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class
    );

    private static final Map<Class<?>, Object> ZEROS = Map.of(
            boolean.class, false,
            byte.class, (byte) 0,
            short.class, (short) 0,
            char.class, (char) 0,
            int.class, 0,
            long.class, 0L,
            float.class, 0f,
            double.class, 0d
    );

    private Types() {
        // utility
    }

    @SuppressWarnings("unchecked")
    static <T> Class<T> boxed(Class<T> type) {
        Class<?> box = BOXES.get(type);
        return box == null ? type : (Class<T>) box;
    }

    /** Zero value for primitives, null for everything else. */
    static Object zero(Class<?> type) {
        return ZEROS.get(type);
    }
}
