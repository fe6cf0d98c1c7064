package de.mirkosertic.mcp.controlmapper.mapping;

/**
 * Service name, analyst note and documentation together did not yield a single query term.
 */
public class EmptyQueryException extends IllegalArgumentException {

    private final String serviceName;

    public EmptyQueryException(final String serviceName) {
        super("Query for service '" + serviceName + "' contains no searchable terms");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
