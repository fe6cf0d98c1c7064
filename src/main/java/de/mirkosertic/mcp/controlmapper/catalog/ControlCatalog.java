package de.mirkosertic.mcp.controlmapper.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of controls. Catalog order is the tie-break order for ranking.
 *
 * <p>Instances are safe to share between threads once constructed.</p>
 */
public final class ControlCatalog {

    private final List<ControlRecord> controls;
    private final Map<String, Integer> positions;
    private final String source;

    private ControlCatalog(final List<ControlRecord> controls, final String source) {
        if (controls.isEmpty()) {
            throw new IllegalArgumentException("A control catalog must contain at least one control");
        }
        final Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < controls.size(); i++) {
            final ControlRecord control = controls.get(i);
            if (index.putIfAbsent(control.id(), i) != null) {
                throw new IllegalArgumentException("Duplicate control id: " + control.id());
            }
        }
        this.controls = Collections.unmodifiableList(new ArrayList<>(controls));
        this.positions = Collections.unmodifiableMap(index);
        this.source = source;
    }

    /**
     * Create a catalog from already validated records.
     *
     * @throws IllegalArgumentException if the list is empty or contains duplicate ids
     */
    public static ControlCatalog of(final List<ControlRecord> controls) {
        return new ControlCatalog(controls, "memory");
    }

    static ControlCatalog of(final List<ControlRecord> controls, final String source) {
        return new ControlCatalog(controls, source);
    }

    public List<ControlRecord> controls() {
        return controls;
    }

    public int size() {
        return controls.size();
    }

    public ControlRecord get(final int position) {
        return controls.get(position);
    }

    public Optional<ControlRecord> find(final String id) {
        final Integer position = positions.get(id);
        return position == null ? Optional.empty() : Optional.of(controls.get(position));
    }

    /**
     * Catalog position of a control, or -1 if the id is unknown.
     */
    public int positionOf(final String id) {
        return positions.getOrDefault(id, -1);
    }

    public boolean contains(final String id) {
        return positions.containsKey(id);
    }

    /**
     * Where the catalog was loaded from (file path, or "memory").
     */
    public String source() {
        return source;
    }
}
