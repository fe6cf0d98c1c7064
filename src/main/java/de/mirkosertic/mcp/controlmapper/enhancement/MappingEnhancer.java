package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.mapping.MappingResult;

/**
 * Post-processing stage that refines a BM25 mapping.
 */
public interface MappingEnhancer {

    EnhancedMapping enhance(MappingResult result, EnhancementContext context);
}
