package de.mirkosertic.mcp.controlmapper.index;

/**
 * A score was requested for a control id that was not part of the catalog the index was built from.
 */
public class UnknownControlException extends IllegalArgumentException {

    private final String controlId;

    public UnknownControlException(final String controlId) {
        super("Control '" + controlId + "' is not part of the relevance index");
        this.controlId = controlId;
    }

    public String getControlId() {
        return controlId;
    }
}
