package com.openrangelabs.copilot.model;

import java.time.LocalDateTime;

/**
 * Call counters for one connector since process start
 */
public class ConnectorMetrics {

    private final String connectorType;
    private final long successfulCalls;
    private final long failedCalls;
    private final String lastError;
    private final LocalDateTime lastUpdated;

    public ConnectorMetrics(String connectorType, long successfulCalls, long failedCalls,
                            String lastError, LocalDateTime lastUpdated) {
        this.connectorType = connectorType;
        this.successfulCalls = successfulCalls;
        this.failedCalls = failedCalls;
        this.lastError = lastError;
        this.lastUpdated = lastUpdated;
    }

    public double getFailureRate() {
        long total = successfulCalls + failedCalls;
        return total > 0 ? (double) failedCalls / total : 0.0;
    }

    public long getTotalCalls() {
        return successfulCalls + failedCalls;
    }

    // Getters
    public String getConnectorType() { return connectorType; }
    public long getSuccessfulCalls() { return successfulCalls; }
    public long getFailedCalls() { return failedCalls; }
    public String getLastError() { return lastError; }
    public LocalDateTime getLastUpdated() { return lastUpdated; }

    @Override
    public String toString() {
        return "ConnectorMetrics{" +
                "connectorType='" + connectorType + '\'' +
                ", successfulCalls=" + successfulCalls +
                ", failedCalls=" + failedCalls +
                ", failureRate=" + String.format("%.2f%%", getFailureRate() * 100) +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
