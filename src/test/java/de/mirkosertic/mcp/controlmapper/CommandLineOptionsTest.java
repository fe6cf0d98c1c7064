package de.mirkosertic.mcp.controlmapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommandLineOptions Tests")
class CommandLineOptionsTest {

    @Test
    @DisplayName("Should parse all options")
    void shouldParseAllOptions() {
        final CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "--controls", "controls.csv",
                "--service", "AWS Timestream",
                "--doc", "timestream.pdf",
                "--note", "firewall misconfiguration",
                "--output", "out/mapping.json",
                "--top-n", "15",
                "--enhance-top-n", "3",
                "--start-page", "2",
                "--end-page", "4"
        });

        assertThat(options.controlsPath()).isEqualTo(Paths.get("controls.csv"));
        assertThat(options.serviceName()).isEqualTo("AWS Timestream");
        assertThat(options.documentPath()).isEqualTo(Paths.get("timestream.pdf"));
        assertThat(options.analystNote()).isEqualTo("firewall misconfiguration");
        assertThat(options.outputPath()).isEqualTo(Paths.get("out/mapping.json"));
        assertThat(options.topN()).isEqualTo(15);
        assertThat(options.enhanceTopN()).isEqualTo(3);
        assertThat(options.startPage()).isEqualTo(2);
        assertThat(options.endPage()).isEqualTo(4);
        assertThat(options.isEnhancementRequested()).isTrue();
        assertThat(options.help()).isFalse();
    }

    @Test
    @DisplayName("Should apply defaults for optional options")
    void shouldApplyDefaults() {
        final CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "--service", "AWS Timestream", "--doc", "timestream.pdf"});

        assertThat(options.controlsPath()).isNull();
        assertThat(options.analystNote()).isEqualTo(CommandLineOptions.DEFAULT_ANALYST_NOTE);
        assertThat(options.outputPath()).isNull();
        assertThat(options.topN()).isNull();
        assertThat(options.isEnhancementRequested()).isFalse();
        assertThat(options.startPage()).isNull();
        assertThat(options.endPage()).isNull();
    }

    @Test
    @DisplayName("Should not require other options when help is requested")
    void shouldAcceptHelpAlone() {
        assertThat(CommandLineOptions.parse(new String[]{"--help"}).help()).isTrue();
        assertThat(CommandLineOptions.parse(new String[]{"-h"}).help()).isTrue();
    }

    @Test
    @DisplayName("Should require service and documentation")
    void shouldRequireServiceAndDocument() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--doc", "a.pdf"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required option --service");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--service", "S3"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required option --doc");
    }

    @Test
    @DisplayName("Should reject unknown options and missing values")
    void shouldRejectMalformedArguments() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--verbose"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown option: --verbose");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--service", "--doc", "a.pdf"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing value for --service");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{"--service", "S3", "--doc"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing value for --doc");
    }

    @Test
    @DisplayName("Should validate numeric options")
    void shouldValidateNumbers() {
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{
                "--service", "S3", "--doc", "a.pdf", "--top-n", "ten"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected a number for --top-n");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{
                "--service", "S3", "--doc", "a.pdf", "--start-page", "0"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--start-page must be at least 1, got 0");
        assertThatThrownBy(() -> CommandLineOptions.parse(new String[]{
                "--service", "S3", "--doc", "a.pdf", "--start-page", "5", "--end-page", "3"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--end-page must not be before --start-page");

        // Zero disables the enhancement assessments but is a valid count
        assertThat(CommandLineOptions.parse(new String[]{
                "--service", "S3", "--doc", "a.pdf", "--enhance-top-n", "0"}).enhanceTopN()).isZero();
    }
}
