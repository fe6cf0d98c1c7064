package de.mirkosertic.mcp.controlmapper.config;

import de.mirkosertic.mcp.controlmapper.analysis.TokenizerSettings;
import de.mirkosertic.mcp.controlmapper.index.Bm25Parameters;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceThresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    private static InputStream yaml(final String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should load the classpath defaults")
    void shouldLoadDefaults() {
        final ApplicationConfig config = ApplicationConfig.defaults();

        assertThat(config.getBm25Parameters()).isEqualTo(Bm25Parameters.defaults());
        assertThat(config.getConfidenceThresholds()).isEqualTo(ConfidenceThresholds.defaults());
        assertThat(config.getTokenizerSettings()).isEqualTo(TokenizerSettings.defaults());
        assertThat(config.getIdColumn()).isEqualTo("id");
        assertThat(config.getDescriptionColumn()).isEqualTo("description");
        assertThat(config.getSecurityPatterns()).hasSize(14);
        assertThat(config.getFallbackMaxChars()).isEqualTo(40000);
        assertThat(config.getMaxDocumentChars()).isEqualTo(5000);
        assertThat(config.getTopN()).isEqualTo(10);
        assertThat(config.getEnhancementTopN()).isEqualTo(5);
        assertThat(config.getEnhancementExcerptChars()).isEqualTo(2000);
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    @DisplayName("Should override defaults from YAML")
    void shouldOverrideFromYaml() {
        // Given
        final String content = """
                controlmapper:
                  catalog:
                    path: /data/controls.csv
                    id-column: Control ID
                    description-column: Control Text
                  tokenizer:
                    min-token-length: 3
                    stemming-language: English
                  bm25:
                    k1: 1.2
                    b: 0.5
                  classifier:
                    high-threshold: 0.8
                    medium-threshold: 0.3
                  query:
                    max-document-chars: 1000
                    top-n: 25
                """;

        // When
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml(content));

        // Then
        assertThat(config.getCatalogPath()).isEqualTo("/data/controls.csv");
        assertThat(config.getIdColumn()).isEqualTo("Control ID");
        assertThat(config.getDescriptionColumn()).isEqualTo("Control Text");
        assertThat(config.getTokenizerSettings()).isEqualTo(new TokenizerSettings(3, "English"));
        assertThat(config.getBm25Parameters()).isEqualTo(new Bm25Parameters(1.2, 0.5));
        assertThat(config.getConfidenceThresholds()).isEqualTo(new ConfidenceThresholds(0.8, 0.3));
        assertThat(config.getMaxDocumentChars()).isEqualTo(1000);
        assertThat(config.getTopN()).isEqualTo(25);
        // Untouched sections keep their defaults
        assertThat(config.getSecurityPatterns()).hasSize(14);
        assertThat(config.getEnhancementTopN()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should replace the security patterns as a whole")
    void shouldReplaceSecurityPatterns() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                controlmapper:
                  extractor:
                    fallback-max-chars: 100
                    patterns:
                      - '\\bsecurity\\b'
                      - '\\bquantum\\b'
                """));

        assertThat(config.getSecurityPatterns()).containsExactly("\\bsecurity\\b", "\\bquantum\\b");
        assertThat(config.getFallbackMaxChars()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should resolve variable defaults in the catalog path")
    void shouldResolveVariableDefaults() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                controlmapper:
                  catalog:
                    path: ${CONTROLMAPPER_TEST_UNSET_VARIABLE:/opt/catalog.csv}
                """));

        assertThat(config.getCatalogPath()).isEqualTo("/opt/catalog.csv");
    }

    @Test
    @DisplayName("Should ignore empty YAML documents")
    void shouldIgnoreEmptyYaml() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml(""));

        assertThat(config.getTopN()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject invalid ranking settings when they are read")
    void shouldRejectInvalidSettings() {
        final ApplicationConfig config = ApplicationConfig.fromYaml(yaml("""
                controlmapper:
                  bm25:
                    b: 1.5
                  classifier:
                    high-threshold: 0.2
                    medium-threshold: 0.6
                """));

        assertThatThrownBy(config::getBm25Parameters).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(config::getConfidenceThresholds).isInstanceOf(IllegalArgumentException.class);
    }
}
