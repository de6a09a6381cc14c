package com.openrangelabs.copilot.connector.crm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.copilot.connector.auth.ConnectorCredentials;
import com.openrangelabs.copilot.exception.ConnectorConfigurationException;
import com.openrangelabs.copilot.http.GatewayRequest;
import com.openrangelabs.copilot.http.HttpGateway;
import com.openrangelabs.copilot.http.RawResponse;
import com.openrangelabs.copilot.http.TransportException;
import com.openrangelabs.copilot.model.ErrorKind;
import com.openrangelabs.copilot.model.PaginationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CrmConnectorTest {

    private static final String BASE_URL = "https://crm.example.com/webservice/";

    @Mock
    private HttpGateway gateway;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CrmConnector connector;

    @BeforeEach
    void setUp() {
        connector = connectorWith(PaginationSettings.defaults());
    }

    private CrmConnector connectorWith(PaginationSettings settings) {
        return new CrmConnector(gateway, objectMapper,
                ConnectorCredentials.basic(BASE_URL, "admin", "access-key"), settings, null);
    }

    private RawResponse response(int status, String body) {
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (Exception e) {
            json = null;
        }
        return new RawResponse(status, body, json);
    }

    private RawResponse rows(int count, int firstId) {
        String result = IntStream.range(firstId, firstId + count)
                .mapToObj(i -> "{\"id\":\"12x" + i + "\",\"email\":\"user" + i + "@example.com\"}")
                .collect(Collectors.joining(",", "[", "]"));
        return response(200, "{\"success\":true,\"result\":" + result + "}");
    }

    @Test
    void query_Success_ReturnsRowsInOrder() {
        // Arrange
        when(gateway.send(any())).thenReturn(Mono.just(response(200, """
            {"success": true, "result": [
                {"id": "12x1", "firstname": "Ana", "email": "ana@example.com"},
                {"id": "12x2", "firstname": "Bruno", "email": "bruno@example.com"}
            ]}
            """)));

        // Act & Assert
        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.isOk()).isTrue();
                assertThat(result.getValue()).extracting(row -> row.get("id")).containsExactly("12x1", "12x2");
                assertThat(result.getValue().get(0).keySet()).containsExactly("id", "firstname", "email");
            })
            .verifyComplete();

        ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway).send(captor.capture());
        GatewayRequest request = captor.getValue();
        assertThat(request.getMethod()).isEqualTo(HttpMethod.GET);
        assertThat(request.getUrl()).isEqualTo("https://crm.example.com/webservice/query");
        assertThat(request.getQueryParams()).containsExactly(Map.entry("query", "SELECT * FROM Contacts;"));
        assertThat(request.getHeaders().get(HttpHeaders.AUTHORIZATION)).startsWith("Basic ");
        assertThat(request.hasBody()).isFalse();
    }

    @Test
    void query_MissingResult_ReturnsEmptyList() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, "{\"success\": true}")));

        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> assertThat(result.getValue()).isEmpty())
            .verifyComplete();
    }

    @Test
    void query_SuccessFalse_ReturnsLogicalError() {
        // Arrange
        when(gateway.send(any())).thenReturn(Mono.just(response(200, """
            {"success": false, "error": {"code": "INVALID_QUERY", "message": "Syntax error near FROM"}}
            """)));

        // Act & Assert
        StepVerifier.create(connector.query("SELECT FROM;"))
            .assertNext(result -> {
                assertThat(result.isErr()).isTrue();
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.LOGICAL_API);
                assertThat(result.getError().getCode()).isEqualTo("INVALID_QUERY");
                assertThat(result.getError().getMessage())
                    .isEqualTo("CRM API error (INVALID_QUERY): Syntax error near FROM");
            })
            .verifyComplete();
    }

    @Test
    void query_SuccessFalseWithoutDetail_UsesDefaults() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, "{\"success\": false}")));

        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.getError().getCode()).isEqualTo("CRM_UNKNOWN_ERROR");
                assertThat(result.getError().getMessage())
                    .isEqualTo("CRM API error (CRM_UNKNOWN_ERROR): Unknown CRM API error.");
            })
            .verifyComplete();
    }

    @Test
    void query_HttpError_IncludesStatusAndBody() {
        when(gateway.send(any())).thenReturn(Mono.just(response(401, "Unauthorized")));

        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.HTTP_STATUS);
                assertThat(result.getError().getHttpStatus()).isEqualTo(401);
                assertThat(result.getError().getMessage()).isEqualTo("HTTP error 401. Detail: Unauthorized");
            })
            .verifyComplete();
    }

    @Test
    void query_HttpErrorWithStructuredBody_UsesRemoteMessage() {
        when(gateway.send(any())).thenReturn(Mono.just(response(500, """
            {"success": false, "error": {"code": "DATABASE_QUERY_ERROR", "message": "Database error"}}
            """)));

        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.HTTP_STATUS);
                assertThat(result.getError().getCode()).isEqualTo("DATABASE_QUERY_ERROR");
                assertThat(result.getError().getMessage()).isEqualTo("HTTP error 500. Detail: Database error");
            })
            .verifyComplete();
    }

    @Test
    void query_UnparseableSuccessBody_ReturnsHttpStatusError() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, "<html>maintenance</html>")));

        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.HTTP_STATUS);
                assertThat(result.getError().getMessage()).contains("maintenance");
            })
            .verifyComplete();
    }

    @Test
    void query_TransportFailure_ReturnsTransportError() {
        when(gateway.send(any())).thenReturn(Mono.error(new TransportException("Connection refused")));

        StepVerifier.create(connector.query("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.TRANSPORT);
                assertThat(result.getError().getMessage()).isEqualTo("Could not reach crm: Connection refused");
            })
            .verifyComplete();

        StepVerifier.create(connector.getMetrics())
            .assertNext(metrics -> {
                assertThat(metrics.getFailedCalls()).isEqualTo(1);
                assertThat(metrics.getLastError()).contains("Connection refused");
            })
            .verifyComplete();
    }

    @Test
    void query_BlankQuery_RejectedWithoutRequest() {
        StepVerifier.create(connector.query("  "))
            .assertNext(result -> assertThat(result.getError().getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT))
            .verifyComplete();

        verifyNoInteractions(gateway);
    }

    @Test
    void retrieveByEmail_Found_ReturnsFirstRecord() {
        // Arrange
        when(gateway.send(any())).thenReturn(Mono.just(response(200, """
            {"success": true, "result": [{"id": "12x7", "email": "ana@example.com", "cf_lead_score": "40"}]}
            """)));

        // Act & Assert
        StepVerifier.create(connector.retrieveByEmail("ana@example.com"))
            .assertNext(result -> {
                assertThat(result.getValue()).containsEntry("id", "12x7").containsEntry("email", "ana@example.com");
            })
            .verifyComplete();

        ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway).send(captor.capture());
        assertThat(captor.getValue().getQueryParams().get("query"))
            .isEqualTo("SELECT * FROM Contacts WHERE email = 'ana@example.com' LIMIT 1;");
    }

    @Test
    void retrieveByEmail_NoRows_ReturnsNotFound() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, "{\"success\": true, \"result\": []}")));

        StepVerifier.create(connector.retrieveByEmail("ghost@example.com", "Leads"))
            .assertNext(result -> {
                assertThat(result.getError().isNotFound()).isTrue();
                assertThat(result.getError().getMessage())
                    .isEqualTo("No Leads record found with email: ghost@example.com.");
            })
            .verifyComplete();

        // Not-found is an answer, not a failed call
        StepVerifier.create(connector.getMetrics())
            .assertNext(metrics -> {
                assertThat(metrics.getSuccessfulCalls()).isEqualTo(1);
                assertThat(metrics.getFailedCalls()).isZero();
            })
            .verifyComplete();
    }

    @Test
    void retrieveByEmail_QuoteInEmail_IsEscaped() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, "{\"success\": true, \"result\": []}")));

        StepVerifier.create(connector.retrieveByEmail("o'neil@example.com"))
            .expectNextCount(1)
            .verifyComplete();

        ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway).send(captor.capture());
        assertThat(captor.getValue().getQueryParams().get("query"))
            .isEqualTo("SELECT * FROM Contacts WHERE email = 'o\\'neil@example.com' LIMIT 1;");
    }

    @Test
    void retrieveByEmail_UnsafeModule_RejectedWithoutRequest() {
        StepVerifier.create(connector.retrieveByEmail("ana@example.com", "Contacts; DELETE"))
            .assertNext(result -> {
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
                assertThat(result.getError().getMessage()).contains("Contacts; DELETE");
            })
            .verifyComplete();

        verifyNoInteractions(gateway);
    }

    @Test
    void quoteLiteral_EscapesBackslashAndQuote() {
        assertThat(CrmConnector.quoteLiteral("a\\b'c")).isEqualTo("'a\\\\b\\'c'");
    }

    @Test
    void queryAll_TwoPages_ConcatenatesInOrder() {
        // Arrange
        when(gateway.send(any())).thenReturn(Mono.just(rows(100, 0)), Mono.just(rows(50, 100)));

        // Act & Assert
        StepVerifier.create(connector.queryAll("SELECT * FROM Contacts;"))
            .assertNext(result -> {
                assertThat(result.getValue()).hasSize(150);
                assertThat(result.getValue().get(0)).containsEntry("id", "12x0");
                assertThat(result.getValue().get(149)).containsEntry("id", "12x149");
            })
            .verifyComplete();

        ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway, times(2)).send(captor.capture());
        assertThat(captor.getAllValues())
            .extracting(request -> request.getQueryParams().get("query"))
            .containsExactly(
                "SELECT * FROM Contacts LIMIT 0, 100;",
                "SELECT * FROM Contacts LIMIT 100, 100;");
    }

    @Test
    void queryAll_EmptyFirstPage_ReturnsEmptyList() {
        when(gateway.send(any())).thenReturn(Mono.just(rows(0, 0)));

        StepVerifier.create(connector.queryAll("SELECT * FROM Leads"))
            .assertNext(result -> assertThat(result.getValue()).isEmpty())
            .verifyComplete();

        verify(gateway, times(1)).send(any());
    }

    @Test
    void queryAll_SecondPageFails_ReturnsErrorWithoutPartialRecords() {
        when(gateway.send(any())).thenReturn(
            Mono.just(rows(100, 0)),
            Mono.just(response(200, "{\"success\": false, \"error\": {\"code\": \"QUERY_TIMEOUT\", \"message\": \"Timed out\"}}")));

        StepVerifier.create(connector.queryAll("SELECT * FROM Contacts"))
            .assertNext(result -> {
                assertThat(result.isErr()).isTrue();
                assertThat(result.getError().getCode()).isEqualTo("QUERY_TIMEOUT");
            })
            .verifyComplete();

        verify(gateway, times(2)).send(any());
    }

    @Test
    void queryAll_EndlessFullPages_StopsAtCeiling() {
        // Every page is full, so only the record ceiling can end the walk
        int[] offset = {0};
        when(gateway.send(any())).thenAnswer(invocation -> {
            RawResponse page = rows(100, offset[0]);
            offset[0] += 100;
            return Mono.just(page);
        });

        StepVerifier.create(connector.queryAll("SELECT * FROM Contacts"))
            .assertNext(result -> assertThat(result.getValue()).hasSize(10_000))
            .verifyComplete();

        verify(gateway, times(100)).send(any());
    }

    @Test
    void queryAll_ThousandSynchronousPages_ReturnsResultInsteadOfOverflowing() {
        RawResponse fullPage = rows(10, 0);
        HttpGateway synchronousGateway = request -> Mono.just(fullPage);
        connector = new CrmConnector(synchronousGateway, objectMapper,
            ConnectorCredentials.basic(BASE_URL, "admin", "access-key"), new PaginationSettings(10, 10_000), null);

        StepVerifier.create(connector.queryAll("SELECT * FROM Contacts"))
            .assertNext(result -> assertThat(result.getValue()).hasSize(10_000))
            .verifyComplete();

        StepVerifier.create(connector.getMetrics())
            .assertNext(metrics -> assertThat(metrics.getSuccessfulCalls()).isEqualTo(1_000))
            .verifyComplete();
    }

    @Test
    void queryAll_CeilingNotMultipleOfPageSize_TruncatesResult() {
        connector = connectorWith(new PaginationSettings(10, 25));
        when(gateway.send(any())).thenReturn(
            Mono.just(rows(10, 0)), Mono.just(rows(10, 10)), Mono.just(rows(10, 20)));

        StepVerifier.create(connector.queryAll("SELECT * FROM Contacts"))
            .assertNext(result -> {
                assertThat(result.getValue()).hasSize(25);
                assertThat(result.getValue().get(24)).containsEntry("id", "12x24");
            })
            .verifyComplete();

        verify(gateway, times(3)).send(any());
    }

    @Test
    void update_SendsOperationEnvelopeWithEncodedElement() throws Exception {
        // Arrange
        when(gateway.send(any())).thenReturn(Mono.just(response(200, """
            {"success": true, "result": {"id": "12x7", "leadstatus": "Hot"}}
            """)));
        Map<String, Object> values = new HashMap<>();
        values.put("leadstatus", "Hot");

        // Act & Assert
        StepVerifier.create(connector.update("12x7", values))
            .assertNext(result -> assertThat(result.getValue()).containsEntry("leadstatus", "Hot"))
            .verifyComplete();

        ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway).send(captor.capture());
        GatewayRequest request = captor.getValue();
        assertThat(request.getMethod()).isEqualTo(HttpMethod.POST);
        assertThat(request.getUrl()).isEqualTo("https://crm.example.com/webservice/update");

        @SuppressWarnings("unchecked")
        Map<String, Object> envelope = (Map<String, Object>) request.getBody();
        assertThat(envelope).containsEntry("operation", "update");
        JsonNode element = objectMapper.readTree((String) envelope.get("element"));
        assertThat(element.path("id").asText()).isEqualTo("12x7");
        assertThat(element.path("leadstatus").asText()).isEqualTo("Hot");

        // Caller's map is left untouched
        assertThat(values).doesNotContainKey("id");
    }

    @Test
    void update_ScoreOutOfRange_RejectedWithoutRequest() {
        StepVerifier.create(connector.update("12x7", Map.of("cf_lead_score", 150)))
            .assertNext(result -> assertThat(result.getError().getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT))
            .verifyComplete();

        verifyNoInteractions(gateway);
    }

    @Test
    void updateLeadScore_Success_ReturnsPreviousAndNewScore() throws Exception {
        // Arrange
        when(gateway.send(any())).thenReturn(
            Mono.just(response(200, """
                {"success": true, "result": [{"id": "12x7", "email": "ana@example.com", "cf_lead_score": "40"}]}
                """)),
            Mono.just(response(200, """
                {"success": true, "result": {"id": "12x7", "cf_lead_score": "85"}}
                """)));

        // Act & Assert
        StepVerifier.create(connector.updateLeadScore("ana@example.com", 85))
            .assertNext(result -> {
                LeadScoreChange change = result.getValue();
                assertThat(change.recordId()).isEqualTo("12x7");
                assertThat(change.previousScore()).isEqualTo("40");
                assertThat(change.newScore()).isEqualTo(85);
            })
            .verifyComplete();

        ArgumentCaptor<GatewayRequest> captor = ArgumentCaptor.forClass(GatewayRequest.class);
        verify(gateway, times(2)).send(captor.capture());
        @SuppressWarnings("unchecked")
        Map<String, Object> envelope = (Map<String, Object>) captor.getAllValues().get(1).getBody();
        JsonNode element = objectMapper.readTree((String) envelope.get("element"));
        assertThat(element.path("cf_lead_score").asInt()).isEqualTo(85);
        assertThat(element.path("id").asText()).isEqualTo("12x7");
    }

    @Test
    void updateLeadScore_OutOfRange_RejectedWithoutRequest() {
        StepVerifier.create(connector.updateLeadScore("ana@example.com", 101))
            .assertNext(result -> assertThat(result.getError().getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT))
            .verifyComplete();
        StepVerifier.create(connector.updateLeadScore("ana@example.com", -1))
            .assertNext(result -> assertThat(result.getError().getKind()).isEqualTo(ErrorKind.INVALID_ARGUMENT))
            .verifyComplete();

        verifyNoInteractions(gateway);
    }

    @Test
    void updateLeadScore_RecordWithoutId_ReturnsLogicalError() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, """
            {"success": true, "result": [{"email": "ana@example.com"}]}
            """)));

        StepVerifier.create(connector.updateLeadScore("ana@example.com", 50))
            .assertNext(result -> {
                assertThat(result.getError().getKind()).isEqualTo(ErrorKind.LOGICAL_API);
                assertThat(result.getError().getMessage()).isEqualTo("CRM record for ana@example.com has no id field.");
            })
            .verifyComplete();

        verify(gateway, times(1)).send(any());
    }

    @Test
    void updateLeadScore_ContactMissing_PassesNotFoundThrough() {
        when(gateway.send(any())).thenReturn(Mono.just(response(200, "{\"success\": true, \"result\": []}")));

        StepVerifier.create(connector.updateLeadScore("ghost@example.com", 50))
            .assertNext(result -> assertThat(result.getError().isNotFound()).isTrue())
            .verifyComplete();
    }

    @Test
    void testConnection_ReflectsQueryOutcome() {
        when(gateway.send(any())).thenReturn(
            Mono.just(rows(1, 0)),
            Mono.just(response(401, "Unauthorized")));

        StepVerifier.create(connector.testConnection()).expectNext(true).verifyComplete();
        StepVerifier.create(connector.testConnection()).expectNext(false).verifyComplete();
    }

    @Test
    void constructor_NonBasicCredentials_FailsFast() {
        ConnectorCredentials bearer = ConnectorCredentials.bearer(BASE_URL, "token");

        assertThatThrownBy(() -> new CrmConnector(gateway, objectMapper, bearer, PaginationSettings.defaults(), null))
            .isInstanceOf(ConnectorConfigurationException.class)
            .hasMessageContaining("crm");
    }

    @Test
    void constructor_DefaultsScoreField() {
        assertThat(connector.getScoreField()).isEqualTo("cf_lead_score");
        assertThat(connector.isProductionReady()).isTrue();
        assertThat(connector.getConnectorType()).isEqualTo("crm");
    }
}
