package com.openrangelabs.copilot.connector.auth;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Stand-in for an OAuth2 client-credentials exchange.
 *
 * <p>No token endpoint is called: every request carries {@link #PLACEHOLDER_TOKEN},
 * which a real server will reject with 401. Replace this provider with one that
 * performs the exchange before relying on client-id/secret configuration.
 */
@Slf4j
public class PlaceholderTokenCredentialProvider implements CredentialProvider {

    public static final String PLACEHOLDER_TOKEN = "client-credentials-placeholder-token";

    public PlaceholderTokenCredentialProvider(String clientId) {
        log.warn("Client id {} configured without a token exchange; requests will use a placeholder token "
                + "and are expected to fail authentication", clientId);
    }

    @Override
    public Mono<String> authorizationHeader() {
        return Mono.just("Bearer " + PLACEHOLDER_TOKEN);
    }

    @Override
    public boolean isProductionReady() {
        return false;
    }
}
