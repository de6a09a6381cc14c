package com.openrangelabs.copilot.service;

import com.openrangelabs.copilot.connector.RestConnector;
import com.openrangelabs.copilot.exception.UnknownConnectorException;
import com.openrangelabs.copilot.model.ConnectorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for probing and monitoring the configured connectors
 */
@Service
public class ConnectorMonitoringService {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorMonitoringService.class);

    private final Map<String, RestConnector> connectors;

    @Autowired
    public ConnectorMonitoringService(List<RestConnector> connectorList) {
        this.connectors = connectorList.stream()
                .collect(Collectors.toMap(RestConnector::getConnectorType, Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate connector type: " + a.getConnectorType());
                        },
                        TreeMap::new));

        logger.info("Initialized monitoring service with connectors: {}", connectors.keySet());
    }

    /**
     * List the configured connectors in type order
     */
    public Flux<RestConnector> getConnectors() {
        return Flux.fromIterable(connectors.values());
    }

    /**
     * Test the connection of one connector
     */
    public Mono<Boolean> testConnection(String connectorType) {
        RestConnector connector = connectors.get(connectorType);
        if (connector == null) {
            return Mono.error(new UnknownConnectorException(connectorType));
        }

        return connector.testConnection()
                .doOnNext(result ->
                        logger.info("Connection test for {}: {}", connectorType, result ? "SUCCESS" : "FAILED"));
    }

    /**
     * Get metrics of all connectors
     */
    public Flux<ConnectorMetrics> getAllMetrics() {
        return Flux.fromIterable(connectors.values())
                .concatMap(RestConnector::getMetrics);
    }
}
