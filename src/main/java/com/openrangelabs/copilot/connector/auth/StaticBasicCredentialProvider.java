package com.openrangelabs.copilot.connector.auth;

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * HTTP Basic credentials, encoded once.
 */
public class StaticBasicCredentialProvider implements CredentialProvider {

    private final String headerValue;

    public StaticBasicCredentialProvider(String username, String secret) {
        this.headerValue = "Basic " + HttpHeaders.encodeBasicAuth(username, secret, StandardCharsets.UTF_8);
    }

    @Override
    public Mono<String> authorizationHeader() {
        return Mono.just(headerValue);
    }
}
