package com.conduitsystems.mailbox;

import com.conduitsystems.BrokerException;

/**
 * The target mailbox no longer accepts messages.
 */
public class MailboxClosedException extends BrokerException {

    public MailboxClosedException(String address) {
        super("Mailbox of " + address + " is closed", address);
    }
}
