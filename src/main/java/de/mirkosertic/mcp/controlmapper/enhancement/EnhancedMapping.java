package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enhanced view of every control of a mapping, in catalog order.
 */
public final class EnhancedMapping {

    private final String serviceName;
    private final Map<String, EnhancedControl> controls;

    public EnhancedMapping(final String serviceName, final Map<String, EnhancedControl> controls) {
        this.serviceName = serviceName;
        this.controls = Collections.unmodifiableMap(new LinkedHashMap<>(controls));
    }

    public String serviceName() {
        return serviceName;
    }

    public Map<String, EnhancedControl> controls() {
        return controls;
    }

    public long assessedCount() {
        return controls.values().stream().filter(EnhancedControl::assessed).count();
    }

    /**
     * Final level of every control still considered applicable.
     */
    public Map<String, ConfidenceLevel> applicableMapping() {
        final Map<String, ConfidenceLevel> result = new LinkedHashMap<>();
        controls.forEach((id, control) -> {
            if (control.applicable()) {
                result.put(id, control.confidence());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * Serializable form of {@link #applicableMapping()}: {@code {"<service>": {"<control id>": "<level>"}}}.
     */
    public Map<String, Map<String, String>> toFinalOutput() {
        final Map<String, String> labels = new LinkedHashMap<>();
        applicableMapping().forEach((id, level) -> labels.put(id, level.label()));
        final Map<String, Map<String, String>> output = new LinkedHashMap<>();
        output.put(serviceName, labels);
        return output;
    }

    /**
     * Serializable form: {@code {"<service>": {"<control id>": {confidence, applicable, ...}}}}.
     */
    public Map<String, Map<String, EnhancedControl>> toOutput() {
        final Map<String, Map<String, EnhancedControl>> output = new LinkedHashMap<>();
        output.put(serviceName, controls);
        return output;
    }
}
