package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.catalog.ControlRecord;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;
import de.mirkosertic.mcp.controlmapper.mapping.MappingResult;
import de.mirkosertic.mcp.controlmapper.mapping.RankedControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a {@link ControlAssessor} over the best-ranked controls of a mapping.
 * Controls outside the top {@code n} keep their BM25 level and stay applicable.
 */
public class AssessingMappingEnhancer implements MappingEnhancer {

    private static final Logger logger = LoggerFactory.getLogger(AssessingMappingEnhancer.class);

    private final ControlAssessor assessor;
    private final int topN;

    public AssessingMappingEnhancer(final ControlAssessor assessor, final int topN) {
        if (topN < 0) {
            throw new IllegalArgumentException("topN must not be negative, got " + topN);
        }
        this.assessor = assessor;
        this.topN = topN;
    }

    @Override
    public EnhancedMapping enhance(final MappingResult result, final EnhancementContext context) {
        final Map<String, EnhancedControl> assessed = new HashMap<>();
        for (final RankedControl control : result.topRanked(topN)) {
            final ControlAssessment assessment = assessor.assess(context.serviceName(), context.securityText(),
                    context.analystNote(), control.description());
            assessed.put(control.id(), new EnhancedControl(control.level(), assessment.confidence(),
                    assessment.applicable(), true, control.description(), assessment.justification()));
            logger.debug("Assessed control {}: {} -> {}, applicable={}",
                    control.id(), control.level(), assessment.confidence(), assessment.applicable());
        }

        final Map<String, EnhancedControl> controls = new LinkedHashMap<>();
        for (final Map.Entry<String, ConfidenceLevel> entry : result.mapping().levels().entrySet()) {
            final String id = entry.getKey();
            final EnhancedControl enhanced = assessed.get(id);
            controls.put(id, enhanced != null
                    ? enhanced
                    : EnhancedControl.unassessed(entry.getValue(), context.catalog().find(id)
                            .map(ControlRecord::description)
                            .orElse("")));
        }

        logger.info("Enhanced mapping for '{}': {} controls assessed", result.serviceName(), assessed.size());
        return new EnhancedMapping(result.serviceName(), controls);
    }

    public int getTopN() {
        return topN;
    }
}
