package com.healthsentinel.core.model;

public record ServiceStats(
        String serviceName,
        long totalChecks,
        long healthyChecks,
        long totalLatencyMillis,
        long stateChanges
) {
    public static ServiceStats empty(String serviceName) {
        return new ServiceStats(serviceName, 0, 0, 0, 0);
    }

    public ServiceStats record(CheckOutcome outcome, boolean changed) {
        return new ServiceStats(
                serviceName,
                totalChecks + 1,
                healthyChecks + (outcome.healthy() ? 1 : 0),
                totalLatencyMillis + Math.max(0, outcome.latencyMillis()),
                stateChanges + (changed ? 1 : 0)
        );
    }

    public long unhealthyChecks() {
        return totalChecks - healthyChecks;
    }

    public double healthRate() {
        return totalChecks == 0 ? 0.0 : (double) healthyChecks / totalChecks;
    }

    public double averageLatencyMillis() {
        return totalChecks == 0 ? 0.0 : (double) totalLatencyMillis / totalChecks;
    }
}
