package com.openrangelabs.copilot.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * {@link HttpGateway} backed by Spring's {@link WebClient}.
 *
 * <p>The base URL is sent as given. Query parameter names and values are
 * percent-encoded, reserved characters such as {@code +}, {@code '} or {@code ,} included.
 */
@Slf4j
@Component
public class WebClientHttpGateway implements HttpGateway {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientHttpGateway(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<RawResponse> send(GatewayRequest request) {
        URI uri;
        try {
            uri = buildUri(request);
        } catch (IllegalArgumentException e) {
            return Mono.error(new TransportException("Invalid request URL: " + request.getUrl(), e));
        }

        WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                .uri(uri)
                .headers(headers -> request.getHeaders().forEach(headers::set));

        WebClient.RequestHeadersSpec<?> exchange = request.hasBody()
                ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.getBody())
                : spec;

        return exchange.exchangeToMono(this::toRawResponse)
                .doOnNext(response -> log.debug("{} {} -> {}", request.getMethod(), request.getUrl(),
                        response.getStatus()))
                .onErrorMap(error -> !(error instanceof TransportException),
                        error -> new TransportException(String.format("%s %s failed: %s",
                                request.getMethod(), request.getUrl(), describe(error)), error));
    }

    private Mono<RawResponse> toRawResponse(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new RawResponse(status, body, parse(body)));
    }

    private URI buildUri(GatewayRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.getUrl());
        request.getQueryParams().forEach((name, value) ->
                builder.queryParam(UriUtils.encode(name, StandardCharsets.UTF_8),
                        UriUtils.encode(value, StandardCharsets.UTF_8)));
        // The base URL is taken as already encoded
        return builder.build(true).toUri();
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
