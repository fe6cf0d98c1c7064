package de.mirkosertic.mcp.controlmapper.extraction;

import de.mirkosertic.mcp.controlmapper.util.TextCleaner;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Converts service documentation (PDF, office formats, HTML, plain text) to text using Apache Tika.
 * For PDFs a page range can be selected; that path reads the file with PDFBox directly.
 */
public class DocumentTextLoader {

    private static final Logger logger = LoggerFactory.getLogger(DocumentTextLoader.class);

    private static final String PDF_MIME_TYPE = "application/pdf";

    private final Tika tika;
    private final Parser parser;

    public DocumentTextLoader() {
        this.tika = new Tika();
        this.parser = new AutoDetectParser();
    }

    public ExtractedDocument load(final Path file) throws IOException {
        return load(file, null, null);
    }

    /**
     * Load the text of a document, optionally restricted to a page range.
     *
     * @param file      the document
     * @param startPage first page, 1-based, or null for the first page
     * @param endPage   last page, 1-based and inclusive, or null for the last page
     */
    public ExtractedDocument load(final Path file, final @Nullable Integer startPage,
                                  final @Nullable Integer endPage) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Documentation file not found");
        }

        final String fileType = tika.detect(file);
        final boolean pageRangeRequested = startPage != null || endPage != null;

        if (pageRangeRequested && PDF_MIME_TYPE.equals(fileType)) {
            return loadPdfPages(file, startPage, endPage);
        }
        if (pageRangeRequested) {
            logger.warn("Page range ignored for non-PDF document {} ({})", file, fileType);
        }
        return loadWithTika(file, fileType);
    }

    private ExtractedDocument loadWithTika(final Path file, final String fileType) throws IOException {
        final long fileSize = Files.size(file);

        try (final InputStream stream = Files.newInputStream(file)) {
            final Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());

            // -1: documentation can be long, never cut it here
            final BodyContentHandler handler = new BodyContentHandler(-1);

            final ParseContext context = new ParseContext();
            context.set(Parser.class, parser);

            try {
                parser.parse(stream, handler, metadata, context);
            } catch (final SAXException | TikaException e) {
                logger.error("Error parsing documentation file: {}", file, e);
                throw new IOException("Failed to parse document " + file, e);
            }

            final String content = TextCleaner.normalizeExtractedText(handler.toString());
            final Integer pages = metadata.getInt(PagedText.N_PAGES);

            logger.info("Extracted {} characters from {} ({}, {} bytes)", content.length(), file, fileType, fileSize);
            return new ExtractedDocument(content, fileType, fileSize, pages == null ? -1 : pages);
        }
    }

    private ExtractedDocument loadPdfPages(final Path file, final @Nullable Integer startPage,
                                           final @Nullable Integer endPage) throws IOException {
        final long fileSize = Files.size(file);

        try (final PDDocument document = Loader.loadPDF(file.toFile())) {
            final int totalPages = document.getNumberOfPages();
            if (totalPages == 0) {
                return new ExtractedDocument("", PDF_MIME_TYPE, fileSize, 0);
            }

            // Clamp to the document, an end before the start collapses to a single page
            final int first = Math.max(1, Math.min(startPage == null ? 1 : startPage, totalPages));
            final int last = Math.max(first, Math.min(endPage == null ? totalPages : endPage, totalPages));

            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(first);
            stripper.setEndPage(last);

            final String content = TextCleaner.normalizeExtractedText(stripper.getText(document));
            logger.info("Extracted pages {}-{} of {} from {} ({} characters)",
                    first, last, totalPages, file, content.length());
            return new ExtractedDocument(content, PDF_MIME_TYPE, fileSize, last - first + 1);
        }
    }
}
