package com.conduitsystems.bus;

import com.conduitsystems.BrokerException;

/**
 * An envelope was published without the routing information it needs.
 */
public class RouteConfigurationException extends BrokerException {

    public RouteConfigurationException(String message) {
        super(message);
    }
}
