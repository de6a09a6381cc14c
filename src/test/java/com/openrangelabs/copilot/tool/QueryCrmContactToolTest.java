package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.connector.crm.CrmConnector;
import com.openrangelabs.copilot.model.ConnectorResult;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QueryCrmContactToolTest {

    @Mock
    private CrmConnector crmConnector;

    private QueryCrmContactTool tool;

    @BeforeEach
    void setUp() {
        tool = new QueryCrmContactTool(crmConnector);
    }

    @Test
    void execute_ContactFound_SummarizesRecord() {
        // Arrange
        Map<String, Object> contact = new LinkedHashMap<>();
        contact.put("id", "12x7");
        contact.put("firstname", "Ana");
        contact.put("lastname", "Souza");
        contact.put("email", "ana@example.com");
        contact.put("phone", null);
        contact.put("mobile", "+55 11 99999-0000");
        contact.put("cf_lead_score", "72");
        contact.put("leadstatus", "Hot");
        contact.put("modifiedtime", "2025-11-10 14:22:01");
        when(crmConnector.getScoreField()).thenReturn("cf_lead_score");
        when(crmConnector.retrieveByEmail("ana@example.com")).thenReturn(Mono.just(ConnectorResult.ok(contact)));

        // Act & Assert
        StepVerifier.create(tool.execute(Map.of("email", " ana@example.com ")))
            .assertNext(result -> {
                assertThat(result)
                    .containsEntry("status", "success")
                    .containsEntry("email", "ana@example.com")
                    .containsEntry("record_id", "12x7")
                    .containsEntry("contact_name", "Ana Souza")
                    .containsEntry("phone", "+55 11 99999-0000")
                    .containsEntry("lead_score", "72")
                    .containsEntry("lead_status", "Hot")
                    .containsEntry("last_activity", "2025-11-10 14:22:01");
            })
            .verifyComplete();
    }

    @Test
    void execute_ContactMissing_ReportsNotFound() {
        when(crmConnector.retrieveByEmail("ghost@example.com")).thenReturn(Mono.just(ConnectorResult.err(
            ErrorInfo.notFound("No Contacts record found with email: ghost@example.com."))));

        StepVerifier.create(tool.execute(Map.of("email", "ghost@example.com")))
            .assertNext(result -> {
                assertThat(result).containsEntry("status", "not_found");
                assertThat(result).containsEntry("message", "No Contacts record found with email: ghost@example.com.");
                assertThat(result).containsEntry("error_kind", "NOT_FOUND");
            })
            .verifyComplete();
    }

    @Test
    void execute_RemoteFailure_ReportsErrorWithCode() {
        when(crmConnector.retrieveByEmail(anyString())).thenReturn(Mono.just(ConnectorResult.err(
            ErrorInfo.of(ErrorKind.LOGICAL_API, "CRM API error (ACCESS_DENIED): Permission denied", "ACCESS_DENIED", 200))));

        StepVerifier.create(tool.execute(Map.of("email", "ana@example.com")))
            .assertNext(result -> {
                assertThat(result).containsEntry("status", "error");
                assertThat(result).containsEntry("error_code", "ACCESS_DENIED");
                assertThat(result).containsEntry("http_status", 200);
            })
            .verifyComplete();
    }

    @Test
    void execute_MissingEmail_ReportsErrorWithoutCall() {
        StepVerifier.create(tool.execute(Map.of()))
            .assertNext(result -> {
                assertThat(result).containsEntry("status", "error");
                assertThat(result).containsEntry("message", "Missing required argument: email");
            })
            .verifyComplete();

        verifyNoInteractions(crmConnector);
    }

    @Test
    void execute_UnexpectedFailure_ReportsErrorInsteadOfFailing() {
        when(crmConnector.retrieveByEmail(anyString())).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(tool.execute(Map.of("email", "ana@example.com")))
            .assertNext(result -> assertThat(result)
                .containsEntry("status", "error")
                .containsEntry("message", "Tool query_vtiger_contact failed: boom"))
            .verifyComplete();
    }
}
