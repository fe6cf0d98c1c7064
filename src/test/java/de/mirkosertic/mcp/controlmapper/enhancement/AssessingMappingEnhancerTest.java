package de.mirkosertic.mcp.controlmapper.enhancement;

import de.mirkosertic.mcp.controlmapper.catalog.ControlCatalog;
import de.mirkosertic.mcp.controlmapper.catalog.ControlRecord;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceLevel;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceMapping;
import de.mirkosertic.mcp.controlmapper.mapping.MappingResult;
import de.mirkosertic.mcp.controlmapper.mapping.RankedControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@DisplayName("AssessingMappingEnhancer Tests")
class AssessingMappingEnhancerTest {

    private static final ControlCatalog CATALOG = ControlCatalog.of(List.of(
            new ControlRecord("AC-1", "Access control policy"),
            new ControlRecord("SC-7", "Boundary protection with firewalls"),
            new ControlRecord("CP-9", "System backup")));

    private ControlAssessor assessor;
    private MappingResult result;
    private EnhancementContext context;

    @BeforeEach
    void setUp() {
        assessor = mock(ControlAssessor.class);

        final Map<String, ConfidenceLevel> levels = new LinkedHashMap<>();
        levels.put("AC-1", ConfidenceLevel.MEDIUM);
        levels.put("SC-7", ConfidenceLevel.HIGH);
        levels.put("CP-9", ConfidenceLevel.LOW);

        // SC-7 ranks first although it is second in the catalog
        result = new MappingResult(new ConfidenceMapping("Timestream", levels), List.of(
                new RankedControl(1, "SC-7", "Boundary protection with firewalls", 2.0, 1.0, ConfidenceLevel.HIGH),
                new RankedControl(2, "AC-1", "Access control policy", 1.0, 0.5, ConfidenceLevel.MEDIUM),
                new RankedControl(3, "CP-9", "System backup", 0.0, 0.0, ConfidenceLevel.LOW)),
                "Firewall rules protect the network.", 12, false);
        context = new EnhancementContext("Timestream", "misconfigured firewall",
                "Firewall rules protect the network.", CATALOG);
    }

    @Test
    @DisplayName("Should assess only the top ranked controls")
    void shouldAssessTopRankedControls() {
        // Given: the assessor rejects the firewall control
        when(assessor.assess("Timestream", "Firewall rules protect the network.", "misconfigured firewall",
                "Boundary protection with firewalls"))
                .thenReturn(new ControlAssessment(false, ConfidenceLevel.LOW, "Service has no network boundary"));

        // When
        final EnhancedMapping enhanced = new AssessingMappingEnhancer(assessor, 1).enhance(result, context);

        // Then: SC-7 carries the verdict, the others keep their BM25 level
        verify(assessor).assess("Timestream", "Firewall rules protect the network.", "misconfigured firewall",
                "Boundary protection with firewalls");
        verifyNoMoreInteractions(assessor);

        assertThat(enhanced.serviceName()).isEqualTo("Timestream");
        assertThat(enhanced.controls()).containsOnlyKeys("AC-1", "SC-7", "CP-9");
        assertThat(enhanced.controls().keySet()).containsExactly("AC-1", "SC-7", "CP-9");
        assertThat(enhanced.assessedCount()).isEqualTo(1);

        final EnhancedControl firewall = enhanced.controls().get("SC-7");
        assertThat(firewall.baseConfidence()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(firewall.confidence()).isEqualTo(ConfidenceLevel.LOW);
        assertThat(firewall.applicable()).isFalse();
        assertThat(firewall.assessed()).isTrue();
        assertThat(firewall.justification()).isEqualTo("Service has no network boundary");

        final EnhancedControl access = enhanced.controls().get("AC-1");
        assertThat(access.confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(access.applicable()).isTrue();
        assertThat(access.assessed()).isFalse();
        assertThat(access.description()).isEqualTo("Access control policy");
        assertThat(access.justification()).isEqualTo(EnhancedControl.BM25_JUSTIFICATION);
    }

    @Test
    @DisplayName("Should drop rejected controls from the applicable mapping")
    void shouldBuildApplicableMapping() {
        when(assessor.assess(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(new ControlAssessment(false, ConfidenceLevel.LOW, "no"));

        final EnhancedMapping enhanced = new AssessingMappingEnhancer(assessor, 1).enhance(result, context);

        assertThat(enhanced.applicableMapping())
                .containsExactly(Map.entry("AC-1", ConfidenceLevel.MEDIUM), Map.entry("CP-9", ConfidenceLevel.LOW));
    }

    @Test
    @DisplayName("Should keep every BM25 level when top N is zero")
    void shouldSkipAssessmentForZeroTopN() {
        final EnhancedMapping enhanced = new AssessingMappingEnhancer(assessor, 0).enhance(result, context);

        verifyNoInteractions(assessor);
        assertThat(enhanced.assessedCount()).isZero();
        assertThat(enhanced.applicableMapping()).isEqualTo(result.mapping().levels());
    }

    @Test
    @DisplayName("Should assess every control when top N exceeds the catalog")
    void shouldAssessAllControlsForLargeTopN() {
        when(assessor.assess(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(new ControlAssessment(true, ConfidenceLevel.MEDIUM, "ok"));

        final EnhancedMapping enhanced = new AssessingMappingEnhancer(assessor, 10).enhance(result, context);

        assertThat(enhanced.assessedCount()).isEqualTo(3);
        assertThat(enhanced.controls().values()).extracting(EnhancedControl::confidence)
                .containsOnly(ConfidenceLevel.MEDIUM);
    }

    @Test
    @DisplayName("Should reject a negative top N")
    void shouldRejectNegativeTopN() {
        assertThatThrownBy(() -> new AssessingMappingEnhancer(assessor, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }
}
