package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.connector.crm.CrmConnector;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Looks up a CRM contact by email and summarizes name, phone, score and status.
 */
@Component
public class QueryCrmContactTool extends AbstractAgentTool {

    public static final String NAME = "query_vtiger_contact";

    private final CrmConnector crmConnector;

    public QueryCrmContactTool(CrmConnector crmConnector) {
        this.crmConnector = crmConnector;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Looks up a contact in the CRM by email and returns name, phone, lead score, status and last activity.";
    }

    @Override
    public Map<String, String> getParameters() {
        return Map.of("email", "Email address of the contact");
    }

    @Override
    protected Mono<Map<String, Object>> invoke(ToolArguments args) {
        String email = args.requireText("email");
        return crmConnector.retrieveByEmail(email)
                .map(result -> result.fold(this::summarize, ToolResults::failure));
    }

    private Map<String, Object> summarize(Map<String, Object> contact) {
        Map<String, Object> summary = ToolResults.success();
        summary.put("email", contact.get("email"));
        summary.put("record_id", stringValue(contact.get("id")));
        summary.put("contact_name", fullName(contact));
        summary.put("phone", contact.get("phone") != null ? contact.get("phone") : contact.get("mobile"));
        summary.put("lead_score", contact.get(crmConnector.getScoreField()));
        summary.put("lead_status", contact.get("leadstatus"));
        summary.put("last_activity", contact.get("modifiedtime"));
        return summary;
    }

    private static String fullName(Map<String, Object> contact) {
        String name = Stream.of(contact.get("firstname"), contact.get("lastname"))
                .filter(Objects::nonNull)
                .map(part -> part.toString().trim())
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(" "));
        return name.isEmpty() ? null : name;
    }
}
