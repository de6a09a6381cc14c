package com.openrangelabs.copilot.connector.auth;

import reactor.core.publisher.Mono;

/**
 * A pre-issued access token. Never refreshed.
 */
public class StaticBearerCredentialProvider implements CredentialProvider {

    private final String headerValue;

    public StaticBearerCredentialProvider(String token) {
        this.headerValue = "Bearer " + token;
    }

    @Override
    public Mono<String> authorizationHeader() {
        return Mono.just(headerValue);
    }
}
