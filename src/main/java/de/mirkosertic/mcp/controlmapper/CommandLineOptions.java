package de.mirkosertic.mcp.controlmapper;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Arguments of the one-shot command line mode.
 *
 * @param controlsPath  catalog CSV, falls back to the configured catalog path when absent
 * @param serviceName   name of the cloud service
 * @param documentPath  documentation file
 * @param analystNote   threat description
 * @param outputPath    optional JSON report target
 * @param topN          number of ranked controls to log, null for the configured default
 * @param enhanceTopN   number of controls to assess, null to skip the enhancement stage
 * @param startPage     first PDF page, 1-based
 * @param endPage       last PDF page, 1-based and inclusive
 * @param help          usage requested
 */
public record CommandLineOptions(
        @Nullable Path controlsPath,
        @Nullable String serviceName,
        @Nullable Path documentPath,
        String analystNote,
        @Nullable Path outputPath,
        @Nullable Integer topN,
        @Nullable Integer enhanceTopN,
        @Nullable Integer startPage,
        @Nullable Integer endPage,
        boolean help
) {

    static final String DEFAULT_ANALYST_NOTE = "A threat agent misconfigured inbound connection settings, "
            + "accept lists, and/or VPC firewall rules, allowing them to bypass security controls and gain "
            + "unauthorized access to sensitive resources and APIs, leading to the theft or disclosure of "
            + "highly confidential data";

    static final String USAGE = """
            Usage: mcp-control-mapper [options]

            Without options the MCP server is started on STDIO.

              --controls <file>       control catalog CSV (default: controlmapper.catalog.path)
              --service <name>        name of the cloud service (required)
              --doc <file>            service documentation, PDF or any format Tika reads (required)
              --note <text>           analyst threat note
              --output <file>         write the JSON report to this file
              --top-n <n>             number of ranked controls to log
              --enhance-top-n <n>     assess the best n controls and write a combined report
              --start-page <n>        first PDF page to analyze, 1-based
              --end-page <n>          last PDF page to analyze, 1-based and inclusive
              --help                  print this help
            """;

    /**
     * @throws IllegalArgumentException on unknown options, missing values or malformed numbers
     */
    public static CommandLineOptions parse(final String[] args) {
        Path controls = null;
        String service = null;
        Path document = null;
        String note = DEFAULT_ANALYST_NOTE;
        Path output = null;
        Integer topN = null;
        Integer enhanceTopN = null;
        Integer startPage = null;
        Integer endPage = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            final String option = args[i];
            switch (option) {
                case "--help", "-h" -> help = true;
                case "--controls" -> controls = Paths.get(valueOf(args, ++i, option));
                case "--service" -> service = valueOf(args, ++i, option);
                case "--doc" -> document = Paths.get(valueOf(args, ++i, option));
                case "--note" -> note = valueOf(args, ++i, option);
                case "--output" -> output = Paths.get(valueOf(args, ++i, option));
                case "--top-n" -> topN = intValueOf(args, ++i, option, 0);
                case "--enhance-top-n" -> enhanceTopN = intValueOf(args, ++i, option, 0);
                case "--start-page" -> startPage = intValueOf(args, ++i, option, 1);
                case "--end-page" -> endPage = intValueOf(args, ++i, option, 1);
                default -> throw new IllegalArgumentException("Unknown option: " + option);
            }
        }

        if (!help) {
            if (service == null || service.isBlank()) {
                throw new IllegalArgumentException("Missing required option --service");
            }
            if (document == null) {
                throw new IllegalArgumentException("Missing required option --doc");
            }
            if (startPage != null && endPage != null && endPage < startPage) {
                throw new IllegalArgumentException("--end-page must not be before --start-page");
            }
        }

        return new CommandLineOptions(controls, service, document, note, output, topN, enhanceTopN,
                startPage, endPage, help);
    }

    public boolean isEnhancementRequested() {
        return enhanceTopN != null;
    }

    private static String valueOf(final String[] args, final int index, final String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int intValueOf(final String[] args, final int index, final String option, final int minimum) {
        final String value = valueOf(args, index, option);
        final int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number for " + option + ", got '" + value + "'", e);
        }
        if (parsed < minimum) {
            throw new IllegalArgumentException(option + " must be at least " + minimum + ", got " + parsed);
        }
        return parsed;
    }
}
