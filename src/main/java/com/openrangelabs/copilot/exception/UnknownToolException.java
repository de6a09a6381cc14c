package com.openrangelabs.copilot.exception;

/**
 * Exception thrown when an invocation names a tool that is not registered.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
public class UnknownToolException extends RuntimeException {

    private final String toolName;

    /**
     * Constructs a new unknown tool exception.
     *
     * @param toolName the name that was requested
     */
    public UnknownToolException(String toolName) {
        super(String.format("No tool registered with name: %s", toolName));
        this.toolName = toolName;
    }

    /**
     * Gets the requested tool name.
     *
     * @return the tool name
     */
    public String getToolName() {
        return toolName;
    }
}
