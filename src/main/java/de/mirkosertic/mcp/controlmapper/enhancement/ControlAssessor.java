package de.mirkosertic.mcp.controlmapper.enhancement;

/**
 * Judges whether a control applies to a service, given the service's security documentation.
 * Implementations backed by a language model plug in here.
 */
public interface ControlAssessor {

    ControlAssessment assess(String serviceName, String securityText, String analystNote, String controlDescription);
}
