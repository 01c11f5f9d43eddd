package com.conduitsystems.message;

import java.util.Objects;

/**
 * A reply value boxed together with its runtime type. The requester checks the tag
 * against the type it asked for before unwrapping.
 *
 * @param <T> the reply value type
 */
public final class TypedReply<T> {

    private final Class<T> type;
    private final T value;

    private TypedReply(Class<T> type, T value) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.value = Objects.requireNonNull(value, "value cannot be null");
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " is not a " + type.getName());
        }
    }

    public static <T> TypedReply<T> of(Class<T> type, T value) {
        return new TypedReply<>(type, value);
    }

    /**
     * Boxes a value tagged with its own class.
     */
    @SuppressWarnings("unchecked")
    public static <T> TypedReply<T> of(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        return new TypedReply<>((Class<T>) value.getClass(), value);
    }

    public Class<T> type() {
        return type;
    }

    /**
     * Returns the value as {@code expected}.
     *
     * @throws ReplyTypeMismatchException if the tag is not assignable to {@code expected}
     */
    public <R> R unwrap(Class<R> expected) {
        if (!expected.isAssignableFrom(type)) {
            throw new ReplyTypeMismatchException(expected, type);
        }
        return expected.cast(value);
    }

    @Override
    public String toString() {
        return "TypedReply{" + type.getSimpleName() + ": " + value + '}';
    }
}
