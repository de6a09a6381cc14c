package com.openrangelabs.copilot.exception;

/**
 * Exception thrown when a request names a connector type that is not configured.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
public class UnknownConnectorException extends RuntimeException {

    private final String connectorType;

    /**
     * Constructs a new unknown connector exception.
     *
     * @param connectorType the requested connector type
     */
    public UnknownConnectorException(String connectorType) {
        super(String.format("No connector found for type: %s", connectorType));
        this.connectorType = connectorType;
    }

    /**
     * Gets the requested connector type.
     *
     * @return the connector type
     */
    public String getConnectorType() {
        return connectorType;
    }
}
