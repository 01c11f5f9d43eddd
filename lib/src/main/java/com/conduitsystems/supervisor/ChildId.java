package com.conduitsystems.supervisor;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque id of a child within its supervisor.
 */
public record ChildId(UUID value) {

    public ChildId {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static ChildId random() {
        return new ChildId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
