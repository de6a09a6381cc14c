package com.openrangelabs.copilot.connector;

import com.openrangelabs.copilot.model.ConnectorMetrics;
import reactor.core.publisher.Mono;

/**
 * Base interface for the REST connectors
 * Lets the web layer list, probe and monitor connectors without knowing their operations
 */
public interface RestConnector {

    /**
     * Get the connector type identifier
     */
    String getConnectorType();

    /**
     * Whether the configured credentials can authenticate against a real server
     */
    boolean isProductionReady();

    /**
     * Issue a cheap read to check that the remote is reachable and accepts the credentials
     */
    Mono<Boolean> testConnection();

    /**
     * Get call counters for this connector
     */
    Mono<ConnectorMetrics> getMetrics();
}
