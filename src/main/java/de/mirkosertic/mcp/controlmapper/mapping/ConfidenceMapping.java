package de.mirkosertic.mcp.controlmapper.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The confidence level of every catalog control for one service, in catalog order.
 */
public final class ConfidenceMapping {

    private final String serviceName;
    private final Map<String, ConfidenceLevel> levels;

    public ConfidenceMapping(final String serviceName, final Map<String, ConfidenceLevel> levels) {
        this.serviceName = serviceName;
        this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
    }

    public String serviceName() {
        return serviceName;
    }

    public Map<String, ConfidenceLevel> levels() {
        return levels;
    }

    public Optional<ConfidenceLevel> levelOf(final String controlId) {
        return Optional.ofNullable(levels.get(controlId));
    }

    public int size() {
        return levels.size();
    }

    public long count(final ConfidenceLevel level) {
        return levels.values().stream().filter(level::equals).count();
    }

    /**
     * Serializable form: {@code {"<service>": {"<control id>": "high"|"medium"|"low"}}}.
     */
    public Map<String, Map<String, String>> toOutput() {
        final Map<String, String> labels = new LinkedHashMap<>();
        levels.forEach((id, level) -> labels.put(id, level.label()));
        final Map<String, Map<String, String>> output = new LinkedHashMap<>();
        output.put(serviceName, labels);
        return output;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfidenceMapping)) {
            return false;
        }
        final ConfidenceMapping that = (ConfidenceMapping) o;
        return serviceName.equals(that.serviceName) && levels.equals(that.levels);
    }

    @Override
    public int hashCode() {
        return 31 * serviceName.hashCode() + levels.hashCode();
    }

    @Override
    public String toString() {
        return "ConfidenceMapping{" + serviceName + "=" + levels + "}";
    }
}
