package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.connector.marketing.MarketingConnector;
import com.openrangelabs.copilot.model.ErrorInfo;
import com.openrangelabs.copilot.model.ErrorKind;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attaches a tag to the marketing contact with the given email.
 */
@Component
public class AddMarketingTagTool extends AbstractAgentTool {

    public static final String NAME = "add_mautic_tag";

    private final MarketingConnector marketingConnector;

    public AddMarketingTagTool(MarketingConnector marketingConnector) {
        this.marketingConnector = marketingConnector;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Adds a tag to a contact in the marketing system, for segmentation.";
    }

    @Override
    public Map<String, String> getParameters() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("email", "Email address of the contact");
        parameters.put("tag", "Tag to add");
        return parameters;
    }

    @Override
    protected Mono<Map<String, Object>> invoke(ToolArguments args) {
        String email = args.requireText("email");
        String tag = args.requireText("tag");
        return marketingConnector.getContactByEmail(email)
                .flatMap(lookup -> lookup.<Mono<Map<String, Object>>>fold(
                        contact -> {
                            String contactId = stringValue(contact.get("id"));
                            if (contactId == null) {
                                return Mono.just(ToolResults.failure(ErrorInfo.of(ErrorKind.LOGICAL_API,
                                        "Marketing contact for " + email + " has no id.")));
                            }
                            return marketingConnector.addTagToContact(contactId, tag)
                                    .map(result -> result.fold(
                                            updated -> describe(email, contactId, tag),
                                            ToolResults::failure));
                        },
                        error -> Mono.just(ToolResults.failure(error))));
    }

    private static Map<String, Object> describe(String email, String contactId, String tag) {
        Map<String, Object> result = ToolResults.success();
        result.put("email", email);
        result.put("contact_id", contactId);
        result.put("tag_added", tag);
        result.put("message", String.format("Tag '%s' added to contact %s.", tag, email));
        return result;
    }
}
