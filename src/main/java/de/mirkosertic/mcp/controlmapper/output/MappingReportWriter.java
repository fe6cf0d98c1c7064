package de.mirkosertic.mcp.controlmapper.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import de.mirkosertic.mcp.controlmapper.enhancement.EnhancedMapping;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceMapping;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes mapping results as indented JSON. Key order follows the catalog, so identical
 * mappings always produce identical bytes.
 */
public class MappingReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(MappingReportWriter.class);

    static final String BASE_MAPPING_KEY = "base_mapping";
    static final String ENHANCED_MAPPING_KEY = "enhanced_mapping";
    static final String FINAL_MAPPING_KEY = "final_mapping";

    private final ObjectWriter writer;

    public MappingReportWriter() {
        this(new ObjectMapper());
    }

    public MappingReportWriter(final ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public String toJson(final ConfidenceMapping mapping) {
        return serialize(mapping.toOutput());
    }

    /**
     * The combined report: base mapping, enhanced mapping and the final mapping of the controls
     * still applicable after enhancement. Without an enhanced mapping this is just the base mapping.
     */
    public String toJson(final ConfidenceMapping mapping, final @Nullable EnhancedMapping enhanced) {
        return serialize(reportOf(mapping, enhanced));
    }

    public void write(final ConfidenceMapping mapping, final Path target) throws IOException {
        writeString(toJson(mapping), target);
    }

    public void write(final ConfidenceMapping mapping, final @Nullable EnhancedMapping enhanced,
                      final Path target) throws IOException {
        writeString(toJson(mapping, enhanced), target);
    }

    private static Object reportOf(final ConfidenceMapping mapping, final @Nullable EnhancedMapping enhanced) {
        if (enhanced == null) {
            return mapping.toOutput();
        }
        final Map<String, Object> report = new LinkedHashMap<>();
        report.put(BASE_MAPPING_KEY, mapping.toOutput());
        report.put(ENHANCED_MAPPING_KEY, enhanced.toOutput());
        report.put(FINAL_MAPPING_KEY, enhanced.toFinalOutput());
        return report;
    }

    private String serialize(final Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (final IOException e) {
            // Only maps of strings and records, cannot fail short of a bug
            throw new UncheckedIOException("Failed to serialize mapping report", e);
        }
    }

    private void writeString(final String json, final Path target) throws IOException {
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, json, StandardCharsets.UTF_8);
        logger.info("Mapping report written to {}", target);
    }
}
