package de.mirkosertic.mcp.controlmapper.extraction;

/**
 * Plain text of a documentation file.
 *
 * @param content   normalized text
 * @param fileType  detected MIME type
 * @param fileSize  size of the source file in bytes
 * @param pageCount number of pages read, or -1 when the format has no page concept
 */
public record ExtractedDocument(
        String content,
        String fileType,
        long fileSize,
        int pageCount
) {
}
