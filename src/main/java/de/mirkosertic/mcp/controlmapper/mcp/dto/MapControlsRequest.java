package de.mirkosertic.mcp.controlmapper.mcp.dto;

import de.mirkosertic.mcp.controlmapper.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the mapControls tool.
 */
public record MapControlsRequest(
        @Description("Name of the cloud service, e.g. 'AWS Timestream'. Becomes part of the query and the key of the mapping.")
        String serviceName,

        @Nullable
        @Description("Analyst note describing the threat scenario.")
        String analystNote,

        @Nullable
        @Description("Security documentation of the service as plain text. Mutually exclusive with documentPath.")
        String documentationText,

        @Nullable
        @Description("Absolute path to the documentation file (PDF, HTML, office formats, text). Mutually exclusive with documentationText.")
        String documentPath,

        @Nullable
        @Description("First PDF page to read, 1-based. Only used with documentPath.")
        Integer startPage,

        @Nullable
        @Description("Last PDF page to read, 1-based and inclusive. Only used with documentPath.")
        Integer endPage,

        @Nullable
        @Description("Number of ranked controls to return. Defaults to the configured value.")
        Integer topN,

        @Nullable
        @Description("If true, the best-ranked controls are additionally assessed and justified. Default is false.")
        Boolean enhance
) {
    /**
     * @throws IllegalArgumentException if an argument has the wrong JSON type
     */
    public static MapControlsRequest fromMap(final Map<String, Object> args) {
        return new MapControlsRequest(
                argument(args, "serviceName", String.class),
                argument(args, "analystNote", String.class),
                argument(args, "documentationText", String.class),
                argument(args, "documentPath", String.class),
                intArgument(args, "startPage"),
                intArgument(args, "endPage"),
                intArgument(args, "topN"),
                argument(args, "enhance", Boolean.class)
        );
    }

    private static @Nullable Integer intArgument(final Map<String, Object> args, final String name) {
        final Number value = argument(args, name, Number.class);
        return value == null ? null : value.intValue();
    }

    private static <T> @Nullable T argument(final Map<String, Object> args, final String name, final Class<T> type) {
        final Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be of type "
                    + type.getSimpleName() + ", got " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    public int effectiveTopN(final int defaultTopN) {
        return (topN != null && topN >= 0) ? topN : defaultTopN;
    }

    public boolean effectiveEnhance() {
        return enhance != null && enhance;
    }

    public boolean hasDocumentPath() {
        return documentPath != null && !documentPath.isBlank();
    }

    public boolean hasDocumentationText() {
        return documentationText != null && !documentationText.isBlank();
    }
}
