package de.mirkosertic.mcp.ragsync.mcp;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Property names follow {@code @JsonProperty} when present. Components annotated with {@link Nullable}
 * are optional, all others required. Enum constants are offered in lower case, the form the tools accept.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            final String name = propertyName(component);
            properties.put(name, propertySchema(component));
            if (!isNullable(component)) {
                required.add(name);
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    // @Nullable is a type-use annotation and sits on the component type, not the component
    static boolean isNullable(final RecordComponent component) {
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    // @JsonProperty does not target record components, it is propagated to the accessor
    static String propertyName(final RecordComponent component) {
        final JsonProperty jsonProperty = component.getAccessor().getAnnotation(JsonProperty.class);
        if (jsonProperty != null && !jsonProperty.value().isEmpty()) {
            return jsonProperty.value();
        }
        return component.getName();
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof Class<?> clazz) {
            addTypeSchema(schema, clazz);
        } else if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && Map.class.isAssignableFrom(raw)) {
            schema.put("type", "object");
            schema.put("additionalProperties", true);
        } else {
            schema.put("type", "string");
        }
        return schema;
    }

    private static void addTypeSchema(final Map<String, Object> schema, final Class<?> clazz) {
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
