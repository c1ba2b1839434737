// file: storage/src/main/java/io/stow/storage/Dispatcher.java
package io.stow.storage;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Callback descriptor for {@link Store#forEach(Dispatcher)}.
 * <p>
 * A dispatcher is built once, before any record is read, and fixes:
 *  - the value type every record is decoded into,
 *  - optionally the key type; without one the callback only sees values.
 * <p>
 * Key handling: a byte[] key parameter receives the raw key, a String or CharSequence parameter
 * its UTF-8 text, any other type is decoded through the store's codec like a value.
 * Primitive parameters receive the type's zero value when a record decodes to null.
 * <p>
 * Three ways to build one:
 *  - {@link #values} and {@link #entries} for typed lambdas,
 *  - {@link #method} and {@link #named} for callbacks discovered at runtime; their parameter
 *    list is validated here and a wrong shape fails with {@link InvalidCallbackException}.
 */
public final class Dispatcher {
    private final Class<?> keyType;
    private final Class<?> valueType;
    private final Invoker invoker;

    private Dispatcher(Class<?> keyType, Class<?> valueType, Invoker invoker) {
        this.keyType = keyType;
        this.valueType = valueType;
        this.invoker = invoker;
    }

    public static <V> Dispatcher values(Class<V> valueType, Consumer<? super V> callback) {
        Objects.requireNonNull(valueType, "valueType");
        if (callback == null) throw new InvalidCallbackException("callback must not be null");
        Class<V> values = Types.boxed(valueType);
        return new Dispatcher(null, valueType, (k, v) -> callback.accept(values.cast(v)));
    }

    public static <K, V> Dispatcher entries(Class<K> keyType, Class<V> valueType,
                                            BiConsumer<? super K, ? super V> callback) {
        Objects.requireNonNull(keyType, "keyType");
        Objects.requireNonNull(valueType, "valueType");
        if (callback == null) throw new InvalidCallbackException("callback must not be null");
        Class<K> keys = Types.boxed(keyType);
        Class<V> values = Types.boxed(valueType);
        return new Dispatcher(keyType, valueType, (k, v) -> callback.accept(keys.cast(k), values.cast(v)));
    }

    /**
     * Dispatch to a method taking (value) or (key, value).
     *
     * @param target receiver, or null for a static method
     * @throws InvalidCallbackException if the method is null, takes another number of
     *                                  parameters, is not accessible, or lacks a receiver
     */
    public static Dispatcher method(Object target, Method method) {
        if (method == null) throw new InvalidCallbackException("callback method must not be null");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new InvalidCallbackException("instance method " + signature(method) + " needs a target");
        }
        if (!isStatic && !method.getDeclaringClass().isInstance(target)) {
            throw new InvalidCallbackException(signature(method) + " cannot be invoked on " + target.getClass().getName());
        }
        if (!Modifier.isPublic(method.getModifiers()) || !Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
            if (!method.trySetAccessible()) {
                throw new InvalidCallbackException(signature(method) + " is not accessible");
            }
        }

        Class<?>[] params = method.getParameterTypes();
        Object receiver = isStatic ? null : target;
        switch (params.length) {
            case 1:
                return new Dispatcher(null, params[0], (k, v) -> invoke(method, receiver, v));
            case 2:
                return new Dispatcher(params[0], params[1], (k, v) -> invoke(method, receiver, k, v));
            default:
                throw new InvalidCallbackException(
                        "callback must take (value) or (key, value), " + signature(method) + " takes " + params.length);
        }
    }

    /**
     * Dispatch to the single method called {@code name} on target's class (public, or declared
     * on the class itself) that takes one or two parameters.
     */
    public static Dispatcher named(Object target, String name) {
        if (target == null) throw new InvalidCallbackException("callback target must not be null");
        Objects.requireNonNull(name, "name");
        List<Method> candidates = new ArrayList<>();
        for (Method m : target.getClass().getMethods()) {
            if (m.getName().equals(name)) candidates.add(m);
        }
        for (Method m : target.getClass().getDeclaredMethods()) {
            if (m.getName().equals(name) && !candidates.contains(m) && !m.isSynthetic()) candidates.add(m);
        }
        if (candidates.isEmpty()) {
            throw new InvalidCallbackException("no method '" + name + "' on " + target.getClass().getName());
        }
        if (candidates.size() > 1) {
            throw new InvalidCallbackException("method '" + name + "' is overloaded on " + target.getClass().getName());
        }
        return method(target, candidates.get(0));
    }

    /** @return the key decode target, or null for a value-only callback */
    public Class<?> keyType() {
        return keyType;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public boolean hasKey() {
        return keyType != null;
    }

    /** Decode one record and invoke the callback. The value is decoded before the key. */
    void dispatch(Store store, byte[] key, byte[] value) {
        Object decodedValue = orZero(store.unmarshal(value, valueType), valueType);
        Object decodedKey = hasKey() ? decodeKey(store, key) : null;
        invoker.invoke(decodedKey, decodedValue);
    }

    private Object decodeKey(Store store, byte[] key) {
        if (keyType == byte[].class) return key;
        if (keyType == String.class || keyType == CharSequence.class) {
            return new String(key, StandardCharsets.UTF_8);
        }
        return orZero(store.unmarshal(key, keyType), keyType);
    }

    private static Object orZero(Object decoded, Class<?> type) {
        return decoded != null ? decoded : Types.zero(type);
    }

    private static void invoke(Method method, Object receiver, Object... args) {
        try {
            method.invoke(receiver, args);
        } catch (IllegalAccessException e) {
            throw new InvalidCallbackException(signature(method) + " is not accessible", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new RuntimeException("callback " + signature(method) + " failed", cause);
        }
    }

    private static String signature(Method m) {
        return m.getDeclaringClass().getSimpleName() + "." + m.getName();
    }

    @FunctionalInterface
    private interface Invoker {
        void invoke(Object key, Object value);
    }
}
