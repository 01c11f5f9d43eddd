package com.conduitsystems.mailbox;

import com.conduitsystems.BrokerException;

/**
 * The target mailbox is at capacity and its strategy rejects further messages.
 */
public class MailboxFullException extends BrokerException {

    private final int capacity;

    public MailboxFullException(String address, int capacity) {
        super("Mailbox of " + address + " is full (capacity " + capacity + ")", address);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
