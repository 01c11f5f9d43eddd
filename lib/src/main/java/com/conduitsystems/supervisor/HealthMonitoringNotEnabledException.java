package com.conduitsystems.supervisor;

/**
 * Health checks were queried on a supervisor that has none configured.
 */
public class HealthMonitoringNotEnabledException extends SupervisorException {

    public HealthMonitoringNotEnabledException(String supervisorName) {
        super("Health monitoring is not enabled on supervisor " + supervisorName, supervisorName);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
