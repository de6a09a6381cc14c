package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.connector.marketing.MarketingConnector;
import com.openrangelabs.copilot.model.ConnectorResult;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.ErrorKind;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Lists the marketing segments of the contact with the given email.
 */
@Component
public class QueryMarketingSegmentsTool extends AbstractAgentTool {

    public static final String NAME = "query_mautic_segment";

    private final MarketingConnector marketingConnector;

    public QueryMarketingSegmentsTool(MarketingConnector marketingConnector) {
        this.marketingConnector = marketingConnector;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Finds a contact in the marketing system by email and lists the segments it belongs to.";
    }

    @Override
    public Map<String, String> getParameters() {
        return Map.of("email", "Email address of the contact");
    }

    @Override
    protected Mono<Map<String, Object>> invoke(ToolArguments args) {
        String email = args.requireText("email");
        return marketingConnector.getContactByEmail(email)
                .flatMap(lookup -> lookup.<Mono<Map<String, Object>>>fold(
                        contact -> {
                            String contactId = stringValue(contact.get("id"));
                            if (contactId == null) {
                                return Mono.just(ToolResults.failure(ErrorInfo.of(ErrorKind.LOGICAL_API,
                                        "Marketing contact for " + email + " has no id.")));
                            }
                            return marketingConnector.getContactSegments(contactId)
                                    .map(segments -> describe(email, contactId, segments));
                        },
                        error -> Mono.just(ToolResults.failure(error))));
    }

    private static Map<String, Object> describe(String email, String contactId,
                                                ConnectorResult<List<Map<String, Object>>> segments) {
        return segments.fold(lists -> {
            Map<String, Object> result = ToolResults.success();
            result.put("email", email);
            result.put("contact_id", contactId);
            result.put("segments", lists.stream()
                    .map(segment -> segment.get("name"))
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.toList()));
            return result;
        }, ToolResults::failure);
    }
}
