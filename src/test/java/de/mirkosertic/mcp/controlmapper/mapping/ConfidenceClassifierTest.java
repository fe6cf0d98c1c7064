package de.mirkosertic.mcp.controlmapper.mapping;

import de.mirkosertic.mcp.controlmapper.index.ScoreVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfidenceClassifier Tests")
class ConfidenceClassifierTest {

    private final ConfidenceClassifier classifier = ConfidenceClassifier.withDefaults();

    private static ScoreVector scores(final double... values) {
        final Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(String.valueOf(i + 1), values[i]);
        }
        return ScoreVector.of(map);
    }

    @Test
    @DisplayName("Should classify relative to the best score with strict thresholds")
    void shouldClassifyRelativeToMax() {
        final Map<String, ConfidenceLevel> levels = classifier.classify(scores(10.0, 7.0, 7.01, 4.0, 4.01, 0.0));

        assertThat(levels).containsExactly(
                Map.entry("1", ConfidenceLevel.HIGH),
                Map.entry("2", ConfidenceLevel.MEDIUM),
                Map.entry("3", ConfidenceLevel.HIGH),
                Map.entry("4", ConfidenceLevel.LOW),
                Map.entry("5", ConfidenceLevel.MEDIUM),
                Map.entry("6", ConfidenceLevel.LOW));
    }

    @Test
    @DisplayName("Should label everything low when no score is positive")
    void shouldLabelAllLowForZeroVector() {
        final Map<String, ConfidenceLevel> levels = classifier.classify(scores(0.0, 0.0, 0.0));

        assertThat(levels.values()).containsOnly(ConfidenceLevel.LOW);
        assertThat(levels).hasSize(3);
    }

    @Test
    @DisplayName("Should never label the best control low when a score is positive")
    void shouldNeverLabelBestControlLow() {
        final Map<String, ConfidenceLevel> levels = classifier.classify(scores(0.0001, 0.00005));

        assertThat(levels.get("1")).isEqualTo(ConfidenceLevel.HIGH);
    }

    @ParameterizedTest(name = "normalized {0} -> {1}")
    @CsvSource({
            "1.0, HIGH",
            "0.71, HIGH",
            "0.7, MEDIUM",
            "0.41, MEDIUM",
            "0.4, LOW",
            "0.0, LOW"
    })
    @DisplayName("Should map normalized scores onto levels")
    void shouldMapNormalizedScores(final double normalized, final ConfidenceLevel expected) {
        assertThat(classifier.levelOf(normalized)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should honor custom thresholds")
    void shouldHonorCustomThresholds() {
        final ConfidenceClassifier strict = new ConfidenceClassifier(new ConfidenceThresholds(0.9, 0.5));

        assertThat(strict.levelOf(0.85)).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(strict.levelOf(0.5)).isEqualTo(ConfidenceLevel.LOW);
    }

    @Test
    @DisplayName("Should reject inconsistent thresholds")
    void shouldRejectInconsistentThresholds() {
        assertThatThrownBy(() -> new ConfidenceThresholds(0.3, 0.6)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceThresholds(1.2, 0.4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceThresholds(0.7, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceThresholds(1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("medium < 1");
    }

    @Test
    @DisplayName("Should keep the best control out of the low band at the tightest allowed thresholds")
    void shouldKeepBestControlAboveLowAtTightThresholds() {
        // given
        final ConfidenceClassifier tight = new ConfidenceClassifier(new ConfidenceThresholds(1.0, 0.99));

        // when
        final Map<String, ConfidenceLevel> levels = tight.classify(scores(2.0, 1.0));

        // then: 1.0 is not above high, but above medium
        assertThat(levels).containsExactly(
                Map.entry("1", ConfidenceLevel.MEDIUM),
                Map.entry("2", ConfidenceLevel.LOW));
    }

    @Test
    @DisplayName("Should serialize levels as lowercase labels")
    void shouldUseLowercaseLabels() {
        assertThat(ConfidenceLevel.HIGH.label()).isEqualTo("high");
        assertThat(ConfidenceLevel.fromLabel(" Medium ")).isEqualTo(ConfidenceLevel.MEDIUM);
    }
}
