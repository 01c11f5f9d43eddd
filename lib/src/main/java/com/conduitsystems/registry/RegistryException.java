package com.conduitsystems.registry;

import com.conduitsystems.BrokerException;

/**
 * The registry cannot serve the request, e.g. because it has been closed.
 */
public class RegistryException extends BrokerException {

    public RegistryException(String message) {
        super(message);
    }
}
