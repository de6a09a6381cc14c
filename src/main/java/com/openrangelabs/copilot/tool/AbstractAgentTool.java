package com.openrangelabs.copilot.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Base class for tools: argument errors and unexpected failures become {@code status:error} maps.
 */
public abstract class AbstractAgentTool implements AgentTool {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @Override
    public Mono<Map<String, Object>> execute(Map<String, Object> arguments) {
        ToolArguments args = new ToolArguments(arguments);
        Mono<Map<String, Object>> invocation;
        try {
            invocation = invoke(args);
        } catch (IllegalArgumentException | ArithmeticException e) {
            logger.debug("Rejected {} call: {}", getName(), e.getMessage());
            return Mono.just(ToolResults.error(e.getMessage()));
        }
        return invocation.onErrorResume(error -> {
            logger.error("Tool {} failed unexpectedly: {}", getName(), error.getMessage(), error);
            return Mono.just(ToolResults.error("Tool " + getName() + " failed: " + error.getMessage()));
        });
    }

    /**
     * Template method: parse arguments and call the connectors
     */
    protected abstract Mono<Map<String, Object>> invoke(ToolArguments args);

    protected static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
