package com.openrangelabs.copilot.connector.auth;

import com.openrangelabs.copilot.exception.ConnectorConfigurationException;
import org.springframework.util.StringUtils;

/**
 * Immutable connection settings captured when a connector is built: the base
 * URL plus exactly one credential shape.
 */
public final class ConnectorCredentials {

    public enum AuthScheme {
        /** username and secret sent as HTTP Basic */
        BASIC,
        /** pre-issued access token sent as Bearer */
        BEARER,
        /** client id and secret that still need a token exchange */
        CLIENT_CREDENTIALS
    }

    private final String baseUrl;
    private final AuthScheme scheme;
    private final String principal;
    private final String secret;

    private ConnectorCredentials(String baseUrl, AuthScheme scheme, String principal, String secret) {
        if (!StringUtils.hasText(baseUrl)) {
            throw new ConnectorConfigurationException("base URL is required");
        }
        this.baseUrl = stripTrailingSlashes(baseUrl.trim());
        this.scheme = scheme;
        this.principal = principal;
        this.secret = secret;
    }

    public static ConnectorCredentials basic(String baseUrl, String username, String secret) {
        if (!StringUtils.hasText(username) || !StringUtils.hasText(secret)) {
            throw new ConnectorConfigurationException("basic authentication needs both a username and a secret");
        }
        return new ConnectorCredentials(baseUrl, AuthScheme.BASIC, username, secret);
    }

    public static ConnectorCredentials bearer(String baseUrl, String token) {
        if (!StringUtils.hasText(token)) {
            throw new ConnectorConfigurationException("bearer authentication needs a token");
        }
        return new ConnectorCredentials(baseUrl, AuthScheme.BEARER, null, token);
    }

    public static ConnectorCredentials clientCredentials(String baseUrl, String clientId, String clientSecret) {
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            throw new ConnectorConfigurationException("client credentials need both a client id and a client secret");
        }
        return new ConnectorCredentials(baseUrl, AuthScheme.CLIENT_CREDENTIALS, clientId, clientSecret);
    }

    /**
     * Picks the first complete credential shape: an access token, then a username
     * and password, then a client id and secret.
     *
     * @throws ConnectorConfigurationException if none of the shapes is complete
     */
    public static ConnectorCredentials resolve(String baseUrl, String accessToken,
                                               String username, String password,
                                               String clientId, String clientSecret) {
        if (StringUtils.hasText(accessToken)) {
            return bearer(baseUrl, accessToken);
        }
        if (StringUtils.hasText(username) && StringUtils.hasText(password)) {
            return basic(baseUrl, username, password);
        }
        if (StringUtils.hasText(clientId) && StringUtils.hasText(clientSecret)) {
            return clientCredentials(baseUrl, clientId, clientSecret);
        }
        throw new ConnectorConfigurationException(
                "no credentials supplied; expected an access token, a username and password, or a client id and secret");
    }

    /**
     * Joins the base URL with a relative endpoint path.
     */
    public String endpoint(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return baseUrl + "/" + relative;
    }

    // Getters
    public String getBaseUrl() { return baseUrl; }
    public AuthScheme getScheme() { return scheme; }
    public String getPrincipal() { return principal; }
    public String getSecret() { return secret; }

    private static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    @Override
    public String toString() {
        return "ConnectorCredentials{" +
                "baseUrl='" + baseUrl + '\'' +
                ", scheme=" + scheme +
                ", principal='" + (principal != null ? principal : "") + '\'' +
                ", secret=****" +
                '}';
    }
}
