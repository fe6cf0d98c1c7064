package de.mirkosertic.mcp.controlmapper.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Wraps response records into MCP tool results.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Serialize the response as the single text content of the result.
     * Responses implementing {@link ToolResponse} with {@code success() == false} are flagged as errors.
     */
    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(response instanceof ToolResponse toolResponse && !toolResponse.success())
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            logger.error("Failed to serialize tool response of type {}", value.getClass().getName(), e);
            return errorJson("JSON serialization error: " + e.getOriginalMessage());
        }
    }

    private static String errorJson(final String message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(Map.of("success", false, "error", message));
        } catch (final JsonProcessingException e) {
            return "{\"success\":false}";
        }
    }
}
