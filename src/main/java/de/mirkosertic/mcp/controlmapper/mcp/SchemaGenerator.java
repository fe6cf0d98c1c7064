package de.mirkosertic.mcp.controlmapper.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * Components annotated with {@link Nullable} are optional, all others are required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, false, null, null);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), false, null, null);
    }

    // JSpecify's @Nullable is a type-use annotation, so it sits on the component's annotated type
    static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Type type = component.getGenericType();

        if (type instanceof Class<?> clazz) {
            schema.put("type", jsonType(clazz));
        } else if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && List.class.isAssignableFrom(raw)) {
            schema.put("type", "array");
            final Type item = parameterized.getActualTypeArguments()[0];
            schema.put("items", Map.of("type", item instanceof Class<?> itemClass ? jsonType(itemClass) : "object"));
        } else {
            schema.put("type", "object");
        }

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }
        return schema;
    }

    private static String jsonType(final Class<?> clazz) {
        if (clazz == String.class || clazz.isEnum()) {
            return "string";
        }
        if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            return "integer";
        }
        if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            return "number";
        }
        if (clazz == Boolean.class || clazz == boolean.class) {
            return "boolean";
        }
        return "object";
    }
}
