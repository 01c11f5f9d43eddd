package com.conduitsystems.address;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifies a message recipient. Addresses are immutable values; their equality and
 * hash code define registry keys.
 */
public sealed interface Address permits Address.Named, Address.Anonymous, Address.PoolMember {

    /**
     * Human readable form, also the input of {@link #routingKey()}.
     */
    String path();

    /**
     * Stable 64-bit hash of the address (FNV-1a over {@link #path()}).
     */
    default long routingKey() {
        long hash = 0xcbf29ce484222325L;
        for (byte b : path().getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= 0x100000001b3L;
        }
        return hash;
    }

    static Address named(String name) {
        return new Named(name);
    }

    static Address anonymous() {
        return new Anonymous(UUID.randomUUID());
    }

    static Address poolMember(String pool, String member) {
        return new PoolMember(pool, member);
    }

    /**
     * A stable, user-chosen name.
     */
    record Named(String name) implements Address {
        public Named {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name cannot be blank");
            }
        }

        @Override
        public String path() {
            return "named:" + name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A generated identifier for actors nobody needs to look up by name.
     */
    record Anonymous(UUID id) implements Address {
        public Anonymous {
            Objects.requireNonNull(id, "id cannot be null");
        }

        @Override
        public String path() {
            return "anonymous:" + id;
        }

        @Override
        public String toString() {
            return "anonymous-" + id;
        }
    }

    /**
     * One interchangeable member of a named pool.
     */
    record PoolMember(String pool, String member) implements Address {
        public PoolMember {
            Objects.requireNonNull(pool, "pool cannot be null");
            Objects.requireNonNull(member, "member cannot be null");
        }

        @Override
        public String path() {
            return "pool:" + pool + "/" + member;
        }

        @Override
        public String toString() {
            return pool + "/" + member;
        }
    }
}
