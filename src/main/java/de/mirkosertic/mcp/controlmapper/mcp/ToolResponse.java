package de.mirkosertic.mcp.controlmapper.mcp;

/**
 * Common shape of all tool responses.
 */
public interface ToolResponse {

    boolean success();

    String error();
}
