package com.conduitsystems.supervisor;

import java.util.Objects;
import java.util.UUID;

/**
 * Id of a supervisor within a {@link SupervisorTree}.
 */
public record SupervisorId(UUID value) {

    public SupervisorId {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static SupervisorId random() {
        return new SupervisorId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
