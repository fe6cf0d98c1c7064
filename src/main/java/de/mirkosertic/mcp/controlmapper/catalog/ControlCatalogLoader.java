package de.mirkosertic.mcp.controlmapper.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the control catalog from a CSV file with a header row.
 *
 * <p>The id and description columns are looked up by name (case-insensitive). Every other
 * column is kept in {@link ControlRecord#attributes()}. Blank lines are skipped and cells
 * are trimmed.</p>
 *
 * <p>Duplicate ids: the last occurrence wins. Its description and attributes replace the
 * earlier ones, but the control keeps the catalog position of its first occurrence, so
 * the ranking tie-break order does not depend on where the duplicate appeared.</p>
 */
public class ControlCatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(ControlCatalogLoader.class);

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final String idColumn;
    private final String descriptionColumn;

    public ControlCatalogLoader(final String idColumn, final String descriptionColumn) {
        if (idColumn == null || idColumn.isBlank() || descriptionColumn == null || descriptionColumn.isBlank()) {
            throw new IllegalArgumentException("Id and description column names must not be blank");
        }
        if (idColumn.trim().equalsIgnoreCase(descriptionColumn.trim())) {
            throw new IllegalArgumentException("Id and description must be different columns: " + idColumn);
        }
        this.idColumn = idColumn.trim();
        this.descriptionColumn = descriptionColumn.trim();
    }

    public static ControlCatalogLoader withDefaultColumns() {
        return new ControlCatalogLoader("id", "description");
    }

    public ControlCatalog load(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Control catalog not found");
        }
        try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    public ControlCatalog load(final Reader reader, final String source) throws IOException {
        try (final MappingIterator<String[]> rows = CSV_MAPPER.readerFor(String[].class).readValues(reader)) {
            final String[] header = readHeader(rows, source);
            final int idIndex = columnIndex(header, idColumn, source);
            final int descriptionIndex = columnIndex(header, descriptionColumn, source);

            final Map<String, ControlRecord> records = new LinkedHashMap<>();
            final Map<String, Integer> firstSeenRecord = new HashMap<>();

            // counts CSV records, not physical lines
            int recordNumber = 1;
            while (rows.hasNextValue()) {
                final String[] row = rows.nextValue();
                recordNumber++;
                if (isBlank(row)) {
                    continue;
                }

                final String id = cell(row, idIndex, recordNumber, idColumn, source);
                if (id.isEmpty()) {
                    throw new CatalogFormatException(
                            "Record " + recordNumber + " of " + source + " has an empty '" + idColumn + "' value",
                            recordNumber, idColumn);
                }
                final String description = cell(row, descriptionIndex, recordNumber, descriptionColumn, source);

                final Map<String, String> attributes = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    if (i != idIndex && i != descriptionIndex) {
                        attributes.put(header[i], i < row.length ? row[i] : "");
                    }
                }

                final Integer previousRecord = firstSeenRecord.putIfAbsent(id, recordNumber);
                if (previousRecord != null) {
                    logger.warn("Duplicate control id '{}' in {} (records {} and {}), keeping the later definition",
                            id, source, previousRecord, recordNumber);
                }
                records.put(id, new ControlRecord(id, description, attributes));
            }

            if (records.isEmpty()) {
                throw new CatalogFormatException("Control catalog " + source + " contains no controls");
            }

            logger.info("Loaded {} controls from {}", records.size(), source);
            return ControlCatalog.of(new ArrayList<>(records.values()), source);

        } catch (final JsonProcessingException e) {
            throw new CatalogFormatException("Malformed CSV in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String[] readHeader(final MappingIterator<String[]> rows, final String source) throws IOException {
        while (rows.hasNextValue()) {
            final String[] header = rows.nextValue();
            if (!isBlank(header)) {
                final String[] cleaned = Arrays.copyOf(header, header.length);
                if (cleaned[0].startsWith(BYTE_ORDER_MARK)) {
                    cleaned[0] = cleaned[0].substring(1);
                }
                for (int i = 0; i < cleaned.length; i++) {
                    cleaned[i] = cleaned[i].trim();
                }
                return cleaned;
            }
        }
        throw new CatalogFormatException("Control catalog " + source + " is empty");
    }

    private static int columnIndex(final String[] header, final String column, final String source)
            throws CatalogFormatException {
        final String wanted = column.toLowerCase(Locale.ROOT);
        for (int i = 0; i < header.length; i++) {
            if (header[i].toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        throw new CatalogFormatException(
                "Control catalog " + source + " has no '" + column + "' column, header is " + Arrays.toString(header),
                1, column);
    }

    private static String cell(final String[] row, final int index, final int recordNumber,
                               final String column, final String source) throws CatalogFormatException {
        if (index >= row.length) {
            throw new CatalogFormatException(
                    "Record " + recordNumber + " of " + source + " has no value for column '" + column + "'",
                    recordNumber, column);
        }
        return row[index] == null ? "" : row[index].trim();
    }

    private static boolean isBlank(final String[] row) {
        if (row == null) {
            return true;
        }
        for (final String cell : row) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
