package de.mirkosertic.mcp.docnav.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Every record component becomes a property; components annotated with {@link Nullable}
 * are optional, all others are required. Enums are offered as lower-case string values.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> requestClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : requestClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!component.isAnnotationPresent(Nullable.class)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without arguments.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && Collection.class.isAssignableFrom(raw)) {
            schema.put("type", "array");
            final Type item = parameterized.getActualTypeArguments()[0];
            final Map<String, Object> itemSchema = new LinkedHashMap<>();
            if (item instanceof Class<?> itemClass) {
                addScalarType(itemSchema, itemClass);
            } else {
                itemSchema.put("type", "string");
            }
            schema.put("items", itemSchema);
        } else if (type instanceof Class<?> clazz) {
            addScalarType(schema, clazz);
        } else {
            schema.put("type", "object");
        }
        return schema;
    }

    private static void addScalarType(final Map<String, Object> schema, final Class<?> clazz) {
        if (clazz == String.class) {
            schema.put("type", "string");
        } else if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            schema.put("type", "integer");
        } else if (clazz == Double.class || clazz == double.class) {
            schema.put("type", "number");
        } else if (clazz == Boolean.class || clazz == boolean.class) {
            schema.put("type", "boolean");
        } else if (clazz.isEnum()) {
            schema.put("type", "string");
            final List<String> values = new ArrayList<>();
            for (final Object constant : clazz.getEnumConstants()) {
                values.add(((Enum<?>) constant).name().toLowerCase(Locale.ROOT));
            }
            schema.put("enum", values);
        } else {
            schema.put("type", "object");
        }
    }
}
