package com.conduitsystems.message;

import com.conduitsystems.BrokerException;

/**
 * A reply arrived for a request but carries a different type than the one requested.
 */
public class ReplyTypeMismatchException extends BrokerException {

    private final Class<?> expected;
    private final Class<?> actual;

    public ReplyTypeMismatchException(Class<?> expected, Class<?> actual) {
        super("Reply type mismatch: expected " + expected.getName() + " but got " + actual.getName());
        this.expected = expected;
        this.actual = actual;
    }

    public Class<?> getExpected() {
        return expected;
    }

    public Class<?> getActual() {
        return actual;
    }
}
