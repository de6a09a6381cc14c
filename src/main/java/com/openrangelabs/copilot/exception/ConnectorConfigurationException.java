package com.openrangelabs.copilot.exception;

/**
 * Thrown while constructing a connector whose configuration cannot work:
 * no usable credentials, a blank base URL, or an authentication scheme the
 * remote system does not support.
 *
 * <p>This is the only connector failure raised as an exception; everything
 * that happens during a call is returned as a result instead.
 *
 * @author OpenRange Labs
 * @version 1.0
 */
public class ConnectorConfigurationException extends RuntimeException {

    private final String connectorType;

    /**
     * @param message the detail message
     */
    public ConnectorConfigurationException(String message) {
        super(message);
        this.connectorType = null;
    }

    /**
     * @param connectorType the connector being configured
     * @param message the detail message
     */
    public ConnectorConfigurationException(String connectorType, String message) {
        super(String.format("Invalid %s connector configuration: %s", connectorType, message));
        this.connectorType = connectorType;
    }

    /**
     * Gets the type of the connector that failed to configure.
     *
     * @return the connector type, or null if not applicable
     */
    public String getConnectorType() {
        return connectorType;
    }
}
