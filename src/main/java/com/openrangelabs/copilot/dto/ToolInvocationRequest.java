package com.openrangelabs.copilot.dto;

import jakarta.validation.constraints.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request DTO for invoking an agent tool
 */
public class ToolInvocationRequest {

    @NotNull(message = "Arguments are required")
    private Map<String, Object> arguments;

    // Constructors
    public ToolInvocationRequest() {}

    public ToolInvocationRequest(Map<String, Object> arguments) {
        this.arguments = arguments != null ? new LinkedHashMap<>(arguments) : null;
    }

    // Getters and Setters
    public Map<String, Object> getArguments() { return arguments; }
    public void setArguments(Map<String, Object> arguments) { this.arguments = arguments; }
}
