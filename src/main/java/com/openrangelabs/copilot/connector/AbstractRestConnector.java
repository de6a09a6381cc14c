package com.openrangelabs.copilot.connector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.copilot.connector.auth.ConnectorCredentials;
import com.openrangelabs.copilot.connector.auth.CredentialProvider;
import com.openrangelabs.copilot.http.GatewayRequest;
import com.openrangelabs.copilot.http.HttpGateway;
import com.openrangelabs.copilot.http.RawResponse;
import com.openrangelabs.copilot.model.ConnectorMetrics;
import com.openrangelabs.copilot.model.ConnectorResult;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.PaginationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Abstract base class for REST connectors
 * Provides authenticated request execution, result normalization and call metrics
 */
public abstract class AbstractRestConnector implements RestConnector {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final HttpGateway gateway;
    protected final ObjectMapper objectMapper;
    protected final ConnectorCredentials credentials;
    protected final CredentialProvider credentialProvider;
    protected final OffsetPaginator paginator;

    private final AtomicLong successfulCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);
    private final AtomicReference<String> lastError = new AtomicReference<>();

    protected AbstractRestConnector(HttpGateway gateway, ObjectMapper objectMapper,
                                    ConnectorCredentials credentials, CredentialProvider credentialProvider,
                                    PaginationSettings pagination) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.credentials = credentials;
        this.credentialProvider = credentialProvider;
        this.paginator = new OffsetPaginator(pagination);
    }

    @Override
    public boolean isProductionReady() {
        return credentialProvider.isProductionReady();
    }

    @Override
    public Mono<ConnectorMetrics> getMetrics() {
        return Mono.fromCallable(() -> new ConnectorMetrics(
                getConnectorType(),
                successfulCalls.get(),
                failedCalls.get(),
                lastError.get(),
                LocalDateTime.now()
        ));
    }

    /**
     * Starts a request against an endpoint relative to the base URL
     */
    protected GatewayRequest.GatewayRequestBuilder request(HttpMethod method, String path) {
        return GatewayRequest.builder()
                .method(method)
                .url(credentials.endpoint(path))
                .header(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    /**
     * Authenticates and sends the request, then turns the response into a result.
     * The returned Mono always emits exactly one result and never errors.
     */
    protected <T> Mono<ConnectorResult<T>> execute(GatewayRequest.GatewayRequestBuilder request,
                                                   Function<RawResponse, ConnectorResult<T>> normalizer) {
        return credentialProvider.authorizationHeader()
                .map(authorization -> request.header(HttpHeaders.AUTHORIZATION, authorization).build())
                .flatMap(gateway::send)
                .map(response -> normalize(response, normalizer))
                .switchIfEmpty(Mono.fromSupplier(() ->
                        ConnectorResult.err(ErrorInfo.transport("No response received from " + getConnectorType() + "."))))
                .onErrorResume(error -> Mono.just(ConnectorResult.err(ErrorInfo.transport(
                        "Could not reach " + getConnectorType() + ": " + error.getMessage()))))
                .doOnNext(this::recordOutcome);
    }

    private <T> ConnectorResult<T> normalize(RawResponse response,
                                             Function<RawResponse, ConnectorResult<T>> normalizer) {
        try {
            return normalizer.apply(response);
        } catch (RuntimeException e) {
            logger.warn("Unexpected {} response shape (HTTP {}): {}",
                    getConnectorType(), response.getStatus(), e.getMessage());
            return ConnectorResult.err(ErrorInfo.httpStatus(response.getStatus(),
                    "Unexpected response from " + getConnectorType() + " (HTTP " + response.getStatus() + "): "
                            + e.getMessage()));
        }
    }

    private void recordOutcome(ConnectorResult<?> result) {
        if (result.isOk()) {
            successfulCalls.incrementAndGet();
            return;
        }
        ErrorInfo error = result.getError();
        if (error.isNotFound()) {
            successfulCalls.incrementAndGet();
            return;
        }
        failedCalls.incrementAndGet();
        lastError.set(error.getMessage());
        if (error.getKind().isLogical()) {
            logger.warn("{} rejected the call [{}]: {}", getConnectorType(), error.getKind(), error.getMessage());
        } else {
            logger.warn("{} call failed [{}]: {}", getConnectorType(), error.getKind(), error.getMessage());
        }
    }

    /**
     * Converts a JSON object into an ordered record map; anything else becomes an empty record
     */
    protected Map<String, Object> toRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(node, RECORD_TYPE);
    }

    /**
     * Collects the object members of an array, or the values of an id-keyed object, in document order
     */
    protected List<Map<String, Object>> toRecords(JsonNode container) {
        if (container == null || !(container.isArray() || container.isObject())) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> records = new ArrayList<>();
        Iterator<JsonNode> elements = container.elements();
        while (elements.hasNext()) {
            JsonNode element = elements.next();
            if (element.isObject()) {
                records.add(toRecord(element));
            }
        }
        return records;
    }

    protected static String textOrDefault(JsonNode node, String fallback) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        String text = node.asText();
        return text == null || text.isBlank() ? fallback : text;
    }

    protected static String describeBody(RawResponse response) {
        String body = response.getBody();
        return body.isBlank() ? "<empty response body>" : body;
    }
}
