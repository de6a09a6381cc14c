package com.openrangelabs.copilot.controller;

import com.openrangelabs.copilot.exception.UnknownConnectorException;
import com.openrangelabs.copilot.model.ConnectorMetrics;
import com.openrangelabs.copilot.service.ConnectorMonitoringService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for connector operations
 * Lists the configured connectors, tests their connections and exposes call metrics
 */
@RestController
@RequestMapping("/api/connectors")
@CrossOrigin(origins = "${copilot.security.cors.allowed-origins}")
public class ConnectorController {

    private final ConnectorMonitoringService monitoringService;

    @Autowired
    public ConnectorController(ConnectorMonitoringService monitoringService) {
        this.monitoringService = monitoringService;
    }

    /**
     * List configured connectors
     *
     * @return connector types with whether their credentials are production ready
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Flux<Map<String, Object>> getConnectors() {
        return monitoringService.getConnectors()
                .map(connector -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("connectorType", connector.getConnectorType());
                    entry.put("productionReady", connector.isProductionReady());
                    return entry;
                });
    }

    /**
     * Get call metrics for every connector
     *
     * @return successful and failed call counts per connector
     */
    @GetMapping("/metrics")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Flux<ConnectorMetrics> getMetrics() {
        return monitoringService.getAllMetrics();
    }

    /**
     * Test connection to external service
     *
     * Issues a one-record read against the remote API with the configured
     * credentials. Use this to verify configuration and troubleshoot connection issues.
     *
     * @param connectorType the connector type (crm, marketing)
     * @return Connection test result with status
     */
    @PostMapping("/{connectorType}/test-connection")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<ResponseEntity<Map<String, Object>>> testConnection(@PathVariable String connectorType) {

        return monitoringService.testConnection(connectorType)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("connectorType", connectorType);
                    response.put("connected", result);
                    response.put("status", result ? "SUCCESS" : "FAILED");
                    response.put("timestamp", LocalDateTime.now());

                    return ResponseEntity.ok(response);
                })
                .onErrorResume(error -> !(error instanceof UnknownConnectorException), error -> {
                    Map<String, Object> errorResponse = new HashMap<>();
                    errorResponse.put("connectorType", connectorType);
                    errorResponse.put("connected", false);
                    errorResponse.put("status", "ERROR");
                    errorResponse.put("error", error.getMessage());
                    errorResponse.put("timestamp", LocalDateTime.now());

                    return Mono.just(ResponseEntity.badRequest().body(errorResponse));
                });
    }
}
