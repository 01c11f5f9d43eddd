package com.conduitsystems.bus;

import com.conduitsystems.BrokerException;

/**
 * The bus has been closed and accepts no more publications or subscriptions.
 */
public class BusClosedException extends BrokerException {

    public BusClosedException() {
        super("Message bus is closed");
    }
}
