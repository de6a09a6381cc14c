package com.openrangelabs.copilot.connector.crm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.copilot.connector.AbstractRestConnector;
import com.openrangelabs.copilot.connector.auth.ConnectorCredentials;
import com.openrangelabs.copilot.connector.auth.CredentialProvider;
import com.openrangelabs.copilot.exception.ConnectorConfigurationException;
import com.openrangelabs.copilot.http.HttpGateway;
import com.openrangelabs.copilot.http.RawResponse;
import com.openrangelabs.copilot.model.ConnectorResult;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.ErrorKind;
import com.openrangelabs.copilot.model.PaginationSettings;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Connector for a Vtiger-style CRM REST API.
 *
 * <p>Reads go through the {@code query} endpoint, which takes a SQL-like query
 * string; writes go through the {@code update} endpoint as an
 * {@code operation=update} envelope whose {@code element} field is the record
 * encoded as a JSON string. The API answers HTTP 200 for logical failures too
 * and flags them with {@code success:false} plus an {@code error.code} /
 * {@code error.message} pair.
 *
 * <p>Only HTTP Basic authentication (username plus access key) is supported.
 */
public class CrmConnector extends AbstractRestConnector {

    public static final String CONNECTOR_TYPE = "crm";
    public static final String DEFAULT_MODULE = "Contacts";
    public static final String DEFAULT_SCORE_FIELD = "cf_lead_score";

    static final String UNKNOWN_ERROR_CODE = "CRM_UNKNOWN_ERROR";

    private static final Pattern MODULE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
    private static final Pattern TRAILING_TERMINATOR = Pattern.compile("[\\s;]+$");

    private final String scoreField;

    public CrmConnector(HttpGateway gateway, ObjectMapper objectMapper, ConnectorCredentials credentials,
                        PaginationSettings pagination, String scoreField) {
        super(gateway, objectMapper, requireBasic(credentials), CredentialProvider.forCredentials(credentials),
                pagination);
        this.scoreField = StringUtils.hasText(scoreField) ? scoreField : DEFAULT_SCORE_FIELD;
    }

    private static ConnectorCredentials requireBasic(ConnectorCredentials credentials) {
        if (credentials == null) {
            throw new ConnectorConfigurationException(CONNECTOR_TYPE, "credentials are required");
        }
        if (credentials.getScheme() != ConnectorCredentials.AuthScheme.BASIC) {
            throw new ConnectorConfigurationException(CONNECTOR_TYPE,
                    "only username and access key authentication is supported, got " + credentials.getScheme());
        }
        return credentials;
    }

    @Override
    public String getConnectorType() {
        return CONNECTOR_TYPE;
    }

    @Override
    public Mono<Boolean> testConnection() {
        return query("SELECT * FROM " + DEFAULT_MODULE + " LIMIT 1;")
                .map(ConnectorResult::isOk);
    }

    /**
     * Runs one query and returns the rows of that single response.
     *
     * <p>The query string is sent verbatim. Callers that splice user input into it
     * must escape that input themselves (see {@link #quoteLiteral(String)}); this
     * method is an injection surface by construction.
     */
    public Mono<ConnectorResult<List<Map<String, Object>>>> query(String queryString) {
        if (!StringUtils.hasText(queryString)) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("A query string is required.")));
        }
        return execute(request(HttpMethod.GET, "query").queryParam("query", queryString),
                response -> unwrap(response).map(this::toRecords));
    }

    /**
     * Pages through every row of a query by appending {@code LIMIT offset, pageSize}.
     *
     * @param baseQuery query without a LIMIT clause; a trailing semicolon is tolerated
     */
    public Mono<ConnectorResult<List<Map<String, Object>>>> queryAll(String baseQuery) {
        if (!StringUtils.hasText(baseQuery)) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("A query string is required.")));
        }
        String base = TRAILING_TERMINATOR.matcher(baseQuery).replaceAll("");
        return paginator.fetchAll("CRM query [" + base + "]", (offset, pageSize) -> {
            String pagedQuery = String.format("%s LIMIT %d, %d;", base, offset, pageSize);
            logger.debug("Executing paginated CRM query: {}", pagedQuery);
            return query(pagedQuery);
        });
    }

    public Mono<ConnectorResult<Map<String, Object>>> retrieveByEmail(String email) {
        return retrieveByEmail(email, DEFAULT_MODULE);
    }

    /**
     * Looks up the first record of a module whose email matches exactly.
     * No match yields a {@link ErrorKind#NOT_FOUND} error naming the module and email.
     */
    public Mono<ConnectorResult<Map<String, Object>>> retrieveByEmail(String email, String module) {
        if (!StringUtils.hasText(email)) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("An email address is required.")));
        }
        if (module == null || !MODULE_NAME.matcher(module).matches()) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("Invalid CRM module name: " + module)));
        }
        String queryString = String.format("SELECT * FROM %s WHERE email = %s LIMIT 1;", module, quoteLiteral(email));
        return query(queryString)
                .map(result -> result.flatMap(rows -> rows.isEmpty()
                        ? ConnectorResult.<Map<String, Object>>err(ErrorInfo.notFound(
                                String.format("No %s record found with email: %s.", module, email)))
                        : ConnectorResult.ok(rows.get(0))));
    }

    /**
     * Updates one record. The caller's map is copied, never modified.
     */
    public Mono<ConnectorResult<Map<String, Object>>> update(String recordId, Map<String, Object> fieldValues) {
        if (!StringUtils.hasText(recordId)) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument("A record id is required.")));
        }
        Map<String, Object> element = fieldValues != null ? new LinkedHashMap<>(fieldValues) : new LinkedHashMap<>();
        ErrorInfo scoreError = validateScore(element.get(scoreField));
        if (scoreError != null) {
            return Mono.just(ConnectorResult.err(scoreError));
        }
        element.put("id", recordId);

        String encodedElement;
        try {
            encodedElement = objectMapper.writeValueAsString(element);
        } catch (JsonProcessingException e) {
            return Mono.just(ConnectorResult.err(ErrorInfo.invalidArgument(
                    "Field values cannot be encoded as JSON: " + e.getOriginalMessage())));
        }

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("operation", "update");
        envelope.put("element", encodedElement);

        return execute(request(HttpMethod.POST, "update").body(envelope),
                response -> unwrap(response).map(this::toRecord));
    }

    /**
     * Finds a contact by email and writes a new value into the score field.
     * Scores outside 0-100 are rejected before any request is sent.
     */
    public Mono<ConnectorResult<LeadScoreChange>> updateLeadScore(String email, int score) {
        ErrorInfo scoreError = validateScore(score);
        if (scoreError != null) {
            return Mono.just(ConnectorResult.err(scoreError));
        }
        return retrieveByEmail(email)
                .flatMap(lookup -> lookup.<Mono<ConnectorResult<LeadScoreChange>>>fold(
                        contact -> {
                            Object id = contact.get("id");
                            if (id == null || !StringUtils.hasText(id.toString())) {
                                return Mono.just(ConnectorResult.err(ErrorInfo.of(ErrorKind.LOGICAL_API,
                                        "CRM record for " + email + " has no id field.")));
                            }
                            String recordId = id.toString();
                            Object previousScore = contact.get(scoreField);
                            Map<String, Object> values = new LinkedHashMap<>();
                            values.put(scoreField, score);
                            return update(recordId, values)
                                    .map(result -> result.map(updated ->
                                            new LeadScoreChange(recordId, previousScore, score)));
                        },
                        error -> Mono.just(ConnectorResult.err(error))));
    }

    /**
     * Quotes a value as a query-language string literal, escaping backslashes and single quotes.
     */
    public static String quoteLiteral(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private ErrorInfo validateScore(Object value) {
        if (value == null) {
            return null;
        }
        double score;
        if (value instanceof Number) {
            score = ((Number) value).doubleValue();
        } else {
            try {
                score = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return ErrorInfo.invalidArgument("Lead score must be a number between 0 and 100, got: " + value);
            }
        }
        if (Double.isNaN(score) || score < 0 || score > 100) {
            return ErrorInfo.invalidArgument("Lead score must be between 0 and 100, got: " + value);
        }
        return null;
    }

    private ConnectorResult<JsonNode> unwrap(RawResponse response) {
        JsonNode json = response.getJson();
        int status = response.getStatus();

        if (!response.is2xxSuccessful()) {
            JsonNode error = json != null ? json.path("error") : null;
            String detail = textOrDefault(error != null ? error.path("message") : null, describeBody(response));
            String code = error != null ? textOrDefault(error.path("code"), null) : null;
            return ConnectorResult.err(ErrorInfo.of(ErrorKind.HTTP_STATUS,
                    String.format("HTTP error %d. Detail: %s", status, detail), code, status));
        }

        if (!response.hasJson() || !json.isObject()) {
            return ConnectorResult.err(ErrorInfo.httpStatus(status,
                    String.format("Unreadable CRM response (HTTP %d): %s", status, describeBody(response))));
        }

        if (!json.path("success").asBoolean(false)) {
            JsonNode error = json.path("error");
            String code = textOrDefault(error.path("code"), UNKNOWN_ERROR_CODE);
            String message = textOrDefault(error.path("message"), "Unknown CRM API error.");
            return ConnectorResult.err(ErrorInfo.of(ErrorKind.LOGICAL_API,
                    String.format("CRM API error (%s): %s", code, message), code, status));
        }

        return ConnectorResult.ok(json.path("result"));
    }

    public String getScoreField() {
        return scoreField;
    }
}
