package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.connector.crm.CrmConnector;
import com.openrangelabs.copilot.connector.crm.LeadScoreChange;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a new lead score (0-100) for the CRM contact with the given email.
 */
@Component
public class UpdateCrmLeadScoreTool extends AbstractAgentTool {

    public static final String NAME = "update_vtiger_lead_score";

    private final CrmConnector crmConnector;

    public UpdateCrmLeadScoreTool(CrmConnector crmConnector) {
        this.crmConnector = crmConnector;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Updates the lead score of a CRM contact. The score must be an integer between 0 and 100.";
    }

    @Override
    public Map<String, String> getParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("email", "Email address of the contact");
        parameters.put("new_score", "New lead score, 0 to 100");
        return parameters;
    }

    @Override
    protected Mono<Map<String, Object>> invoke(ToolArguments args) {
        String email = args.requireText("email");
        int newScore = args.requireInt("new_score");
        return crmConnector.updateLeadScore(email, newScore)
                .map(result -> result.fold(change -> describe(email, change), ToolResults::failure));
    }

    private static Map<String, Object> describe(String email, LeadScoreChange change) {
        Map<String, Object> result = ToolResults.success();
        result.put("email", email);
        result.put("record_id", change.recordId());
        result.put("old_score", change.previousScore());
        result.put("new_score", change.newScore());
        result.put("message", String.format("Lead score of %s updated to %d.", email, change.newScore()));
        return result;
    }
}
