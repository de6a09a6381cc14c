package com.openrangelabs.copilot.connector.auth;

import reactor.core.publisher.Mono;

/**
 * Supplies the {@code Authorization} header value for each outgoing request.
 *
 * <p>Implementations may cache or refresh tokens; the connectors ask once per request.
 */
public interface CredentialProvider {

    Mono<String> authorizationHeader();

    /**
     * Whether the provider yields credentials the remote will actually accept.
     */
    default boolean isProductionReady() {
        return true;
    }

    static CredentialProvider forCredentials(ConnectorCredentials credentials) {
        return switch (credentials.getScheme()) {
            case BASIC -> new StaticBasicCredentialProvider(credentials.getPrincipal(), credentials.getSecret());
            case BEARER -> new StaticBearerCredentialProvider(credentials.getSecret());
            case CLIENT_CREDENTIALS -> new PlaceholderTokenCredentialProvider(credentials.getPrincipal());
        };
    }
}
