package com.conduitsystems;

import com.conduitsystems.address.Address;

/**
 * An actor could not be spawned: its address is taken or it failed to start.
 */
public class ActorSpawnException extends ConduitException {

    public ActorSpawnException(Address address, String reason) {
        super("Cannot spawn actor " + address + ": " + reason, address.toString());
    }

    public ActorSpawnException(Address address, String reason, Throwable cause) {
        super("Cannot spawn actor " + address + ": " + reason, cause, address.toString());
    }
}
