package de.mirkosertic.mcp.controlmapper.mcp;

import de.mirkosertic.mcp.controlmapper.mcp.dto.GetControlRequest;
import de.mirkosertic.mcp.controlmapper.mcp.dto.MapControlsRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaGenerator Tests")
class SchemaGeneratorTest {

    @Test
    @DisplayName("Should require only non-nullable components")
    void shouldDeriveRequiredFields() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(MapControlsRequest.class);

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.required()).containsExactly("serviceName");
        assertThat(schema.additionalProperties()).isFalse();
        assertThat(schema.properties()).containsOnlyKeys("serviceName", "analystNote", "documentationText",
                "documentPath", "startPage", "endPage", "topN", "enhance");
    }

    @Test
    @DisplayName("Should map component types to JSON types")
    @SuppressWarnings("unchecked")
    void shouldMapTypes() {
        final Map<String, Object> properties = SchemaGenerator.generateSchema(MapControlsRequest.class).properties();

        assertThat(((Map<String, Object>) properties.get("serviceName")).get("type")).isEqualTo("string");
        assertThat(((Map<String, Object>) properties.get("startPage")).get("type")).isEqualTo("integer");
        assertThat(((Map<String, Object>) properties.get("enhance")).get("type")).isEqualTo("boolean");
        assertThat((String) ((Map<String, Object>) properties.get("serviceName")).get("description"))
                .contains("cloud service");
    }

    @Test
    @DisplayName("Should detect type-use nullability")
    void shouldDetectNullable() {
        final var components = MapControlsRequest.class.getRecordComponents();

        assertThat(SchemaGenerator.isNullable(components[0])).isFalse();
        assertThat(SchemaGenerator.isNullable(components[1])).isTrue();
    }

    @Test
    @DisplayName("Should generate an empty schema for tools without parameters")
    void shouldGenerateEmptySchema() {
        final McpSchema.JsonSchema schema = SchemaGenerator.emptySchema();

        assertThat(schema.properties()).isEmpty();
        assertThat(schema.required()).isEmpty();
        assertThat(SchemaGenerator.generateSchema(GetControlRequest.class).required()).containsExactly("controlId");
    }
}
