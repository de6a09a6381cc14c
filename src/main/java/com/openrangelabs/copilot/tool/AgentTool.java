package com.openrangelabs.copilot.tool;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A named callable the agent layer can invoke with primitive arguments.
 *
 * <p>The result is a JSON-serializable map whose {@code status} entry is one of
 * {@code success}, {@code not_found} or {@code error}. Failures are reported in
 * the map; the returned Mono does not error.
 */
public interface AgentTool {

    /** Unique snake_case name the agent uses to invoke this tool */
    String getName();

    /** What the tool does, phrased for the agent */
    String getDescription();

    /** Parameter names mapped to short descriptions, in call order */
    Map<String, String> getParameters();

    Mono<Map<String, Object>> execute(Map<String, Object> arguments);
}
