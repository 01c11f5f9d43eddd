package com.conduitsystems.mailbox;

import com.conduitsystems.BrokerException;

import java.time.Duration;

/**
 * A blocking send did not find room in the mailbox within the send timeout.
 */
public class SendTimeoutException extends BrokerException {

    private final Duration timeout;

    public SendTimeoutException(String address, Duration timeout) {
        this(address, timeout, null);
    }

    public SendTimeoutException(String address, Duration timeout, Throwable cause) {
        super("Send to " + address + " timed out after " + timeout.toMillis() + "ms", cause, address);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
