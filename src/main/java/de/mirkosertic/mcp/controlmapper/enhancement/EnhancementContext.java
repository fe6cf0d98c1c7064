package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalog;

/**
 * Inputs of a mapping run that an enhancer may look at in addition to the mapping itself.
 */
public record EnhancementContext(
        String serviceName,
        String analystNote,
        String securityText,
        ControlCatalog catalog
) {
}
