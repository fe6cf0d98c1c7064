package de.mirkosertic.mcp.controlmapper.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One security control from the catalog.
 *
 * @param id          unique control identifier
 * @param description control text that is indexed for ranking
 * @param attributes  all other catalog columns, in header order; carried through unused
 */
public record ControlRecord(String id, String description, Map<String, String> attributes) {

    public ControlRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Control id must not be blank");
        }
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public ControlRecord(final String id, final String description) {
        this(id, description, Map.of());
    }
}
