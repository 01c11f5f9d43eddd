package com.conduitsystems.registry;

import com.conduitsystems.BrokerException;
import com.conduitsystems.address.Address;

/**
 * No mailbox is registered under the address.
 */
public class AddressNotFoundException extends BrokerException {

    private final Address address;

    public AddressNotFoundException(Address address) {
        super("No actor registered at " + address, String.valueOf(address));
        this.address = address;
    }

    public Address getAddress() {
        return address;
    }
}
