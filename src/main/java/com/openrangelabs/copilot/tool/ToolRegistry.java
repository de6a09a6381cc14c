package com.openrangelabs.copilot.tool;

import com.openrangelabs.copilot.exception.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Indexes the tool beans by name and dispatches invocations to them.
 */
@Service
public class ToolRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, AgentTool> tools = new TreeMap<>();

    public ToolRegistry(List<AgentTool> toolList) {
        for (AgentTool tool : toolList) {
            AgentTool previous = tools.put(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        }
        logger.info("Registered agent tools: {}", tools.keySet());
    }

    public Optional<AgentTool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<AgentTool> getTools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /**
     * Runs a tool by name; an unknown name signals {@link UnknownToolException}.
     */
    public Mono<Map<String, Object>> execute(String name, Map<String, Object> arguments) {
        Map<String, Object> safeArguments = arguments != null ? arguments : Map.of();
        return getTool(name)
                .map(tool -> {
                    logger.debug("Invoking tool {} with arguments {}", name, safeArguments.keySet());
                    return tool.execute(safeArguments);
                })
                .orElseGet(() -> Mono.error(new UnknownToolException(name)));
    }
}
