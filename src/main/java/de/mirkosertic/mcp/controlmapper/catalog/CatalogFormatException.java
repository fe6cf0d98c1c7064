package de.mirkosertic.mcp.controlmapper.catalog;

import java.io.IOException;

/**
 * The control catalog cannot be used: no header, a required column is missing,
 * a row is incomplete, or no controls remain.
 */
public class CatalogFormatException extends IOException {

    private final int recordNumber;
    private final String column;

    public CatalogFormatException(final String message) {
        this(message, -1, null);
    }

    public CatalogFormatException(final String message, final int recordNumber, final String column) {
        super(message);
        this.recordNumber = recordNumber;
        this.column = column;
    }

    public CatalogFormatException(final String message, final Throwable cause) {
        super(message, cause);
        this.recordNumber = -1;
        this.column = null;
    }

    /**
     * 1-based CSV record number of the offending row (the header is record 1), or -1 if the problem is not tied
     * to a row. This is not a physical line number when quoted cells span several lines.
     */
    public int getRecordNumber() {
        return recordNumber;
    }

    /**
     * Offending column name, or null.
     */
    public String getColumn() {
        return column;
    }
}
