package com.openrangelabs.copilot.connector.marketing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.copilot.connector.AbstractRestConnector;
import com.openrangelabs.copilot.connector.auth.ConnectorCredentials;
import com.openrangelabs.copilot.connector.auth.CredentialProvider;
import com.openrangelabs.copilot.exception.ConnectorConfigurationException;
import com.openrangelabs.copilot.http.HttpGateway;
import com.openrangelabs.copilot.http.RawResponse;
import com.openrangelabs.copilot.model.ConnectorResult;
import com.openrangelabs.copilot.model.ContactPage;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.ErrorKind;
import com.openrangelabs.copilot.model.PaginationSettings;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Connector for a Mautic-style marketing automation REST API.
 *
 * <p>Contact lists come back as an object keyed by contact id; records are
 * returned in the order the remote serialized them. Validation failures arrive
 * as {@code {"errors":[{"message":...,"code":...}]}} under any HTTP status and
 * are reported as {@link ErrorKind#VALIDATION}.
 *
 * <p>Authentication is a bearer token, HTTP Basic, or a client id and secret;
 * the last one is accepted but only yields a placeholder token.
 */
public class MarketingConnector extends AbstractRestConnector {

    public static final String CONNECTOR_TYPE = "marketing";

    private static final Pattern CONTACT_ID = Pattern.compile("[A-Za-z0-9_-]+");

    public MarketingConnector(HttpGateway gateway, ObjectMapper objectMapper, ConnectorCredentials credentials,
                              PaginationSettings pagination) {
        this(gateway, objectMapper, requireCredentials(credentials), CredentialProvider.forCredentials(credentials),
                pagination);
    }

    public MarketingConnector(HttpGateway gateway, ObjectMapper objectMapper, ConnectorCredentials credentials,
                              CredentialProvider credentialProvider, PaginationSettings pagination) {
        super(gateway, objectMapper, requireCredentials(credentials), credentialProvider, pagination);
    }

    private static ConnectorCredentials requireCredentials(ConnectorCredentials credentials) {
        if (credentials == null) {
            throw new ConnectorConfigurationException(CONNECTOR_TYPE, "credentials are required");
        }
        return credentials;
    }

    @Override
    public String getConnectorType() {
        return CONNECTOR_TYPE;
    }

    @Override
    public Mono<Boolean> testConnection() {
        return listContacts(1, 0).map(ConnectorResult::isOk);
    }

    /**
     * Finds a contact through the search endpoint, since the API has no direct
     * lookup by email. The first returned contact wins.
     */
    public Mono<ConnectorResult<Map<String, Object>>> getContactByEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("An email address is required.")));
        }
        return execute(request(HttpMethod.GET, "contacts")
                        .queryParam("search", "email:" + email)
                        .queryParam("limit", "1"),
                response -> unwrap(response).<Map<String, Object>>flatMap(json -> {
                    List<Map<String, Object>> contacts = toRecords(json.path("contacts"));
                    return contacts.isEmpty()
                            ? ConnectorResult.err(ErrorInfo.notFound(
                                    "No marketing contact found with email: " + email + "."))
                            : ConnectorResult.ok(contacts.get(0));
                }));
    }

    /**
     * Fetches one page of contacts together with the remote's total count.
     */
    public Mono<ConnectorResult<ContactPage>> listContacts(int limit, int start) {
        if (limit <= 0 || start < 0) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument(
                    String.format("Invalid page window: limit=%d, start=%d", limit, start))));
        }
        return execute(request(HttpMethod.GET, "contacts")
                        .queryParam("limit", String.valueOf(limit))
                        .queryParam("start", String.valueOf(start)),
                response -> unwrap(response).map(json -> {
                    List<Map<String, Object>> contacts = toRecords(json.path("contacts"));
                    return new ContactPage(contacts, json.path("total").asLong(contacts.size()));
                }));
    }

    /**
     * Pages through every contact, page size and record ceiling taken from the pagination settings.
     */
    public Mono<ConnectorResult<List<Map<String, Object>>>> listAllContacts() {
        return paginator.fetchAll("marketing contacts", (offset, pageSize) -> {
            logger.debug("Listing marketing contacts: start={}, limit={}", offset, pageSize);
            return listContacts(pageSize, offset)
                    .map(result -> result.map(ContactPage::records));
        });
    }

    public Mono<ConnectorResult<Map<String, Object>>> addTagToContact(String contactId, String tag) {
        ErrorInfo invalid = validateContactId(contactId);
        if (invalid != null) {
            return Mono.just(ConnectorResult.err(invalid));
        }
        if (!StringUtils.hasText(tag)) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("A tag is required.")));
        }
        return execute(request(HttpMethod.POST, "contacts/" + contactId + "/tags/add")
                        .body(Map.of("tags", List.of(tag))),
                response -> unwrap(response).map(json ->
                        json.has("contact") ? toRecord(json.get("contact")) : toRecord(json)));
    }

    /**
     * Lists the segments a contact belongs to.
     */
    public Mono<ConnectorResult<List<Map<String, Object>>>> getContactSegments(String contactId) {
        ErrorInfo invalid = validateContactId(contactId);
        if (invalid != null) {
            return Mono.just(ConnectorResult.err(invalid));
        }
        return execute(request(HttpMethod.GET, "contacts/" + contactId + "/segments"),
                response -> unwrap(response).map(json -> toRecords(json.path("lists"))));
    }

    private static ErrorInfo validateContactId(String contactId) {
        if (contactId == null || !CONTACT_ID.matcher(contactId).matches()) {
            return ErrorInfo.invalidArgument("Invalid marketing contact id: " + contactId);
        }
        return null;
    }

    private ConnectorResult<JsonNode> unwrap(RawResponse response) {
        JsonNode json = response.getJson();
        int status = response.getStatus();

        JsonNode firstError = json != null ? json.path("errors").path(0) : null;
        if (firstError != null && firstError.isObject() && firstError.hasNonNull("message")) {
            String code = textOrDefault(firstError.path("code"), null);
            return ConnectorResult.err(ErrorInfo.of(ErrorKind.VALIDATION,
                    "Marketing validation error: " + firstError.get("message").asText(), code, status));
        }

        if (!response.is2xxSuccessful()) {
            return ConnectorResult.err(ErrorInfo.httpStatus(status,
                    String.format("HTTP error %d. Detail: %s", status, describeBody(response))));
        }

        if (!response.hasJson() || !json.isObject()) {
            return ConnectorResult.err(ErrorInfo.httpStatus(status,
                    String.format("Unreadable marketing response (HTTP %d): %s", status, describeBody(response))));
        }

        JsonNode error = json.path("error");
        if (error.isObject() && error.hasNonNull("message")) {
            String code = textOrDefault(error.path("code"), null);
            return ConnectorResult.err(ErrorInfo.of(ErrorKind.LOGICAL_API,
                    "Marketing API error: " + error.get("message").asText(), code, status));
        }

        return ConnectorResult.ok(json);
    }
}
