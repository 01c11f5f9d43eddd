package com.conduitsystems.supervisor;

import com.conduitsystems.ConduitException;

/**
 * The failure injected into supervision when a child keeps failing its health check.
 */
public class HealthCheckFailedException extends ConduitException {

    public HealthCheckFailedException(String childName, int consecutiveFailures, String reason) {
        super("Child '" + childName + "' failed " + consecutiveFailures + " consecutive health checks: " + reason,
                childName);
    }
}
