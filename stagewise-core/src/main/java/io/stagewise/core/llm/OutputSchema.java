package io.stagewise.core.llm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Expected structure of a generated value, with the binding into a Java type.
///
/// Providers obtain a JSON object from the model and pass it as a `Map` to {@link #bind};
/// the binder converts it, usually through {@link StructuredValues}.
///
/// @param name schema name, not null
/// @param description what the value represents, never null
/// @param fields top-level fields, not empty
/// @param binder converts the raw object into the result type, not null
/// @param <T> bound result type
public record OutputSchema<T>(
        String name, String description, List<SchemaField> fields, Function<Map<String, Object>, T> binder) {

    public OutputSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(binder, "binder must not be null");
        description = description != null ? description : "";
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Schema '" + name + "' declares no fields");
        }
    }

    /// Binds a raw generated object.
    ///
    /// @param raw decoded JSON object, not null
    /// @return the bound value, never null
    /// @throws GenerationException if a required field is missing or has the wrong type
    public T bind(Map<String, Object> raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        for (SchemaField field : fields) {
            if (field.required() && raw.get(field.name()) == null) {
                throw new GenerationException(
                        "Generated " + name + " is missing required field '" + field.name() + "'");
            }
        }
        try {
            return binder.apply(raw);
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new GenerationException("Generated " + name + " does not fit the schema", e);
        }
    }

    /// Renders the schema as a JSON-Schema object tree.
    ///
    /// @return nested maps and lists, never null
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = objectSchema(fields);
        schema.put("title", name);
        if (!description.isEmpty()) {
            schema.put("description", description);
        }
        return schema;
    }

    private static Map<String, Object> objectSchema(List<SchemaField> fields) {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = fields.stream().filter(SchemaField::required).map(SchemaField::name).toList();
        for (SchemaField field : fields) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", field.type().jsonType());
            if (!field.description().isEmpty()) {
                property.put("description", field.description());
            }
            if (field.type() == FieldType.OBJECT_LIST) {
                property.put("items", objectSchema(field.itemFields()));
            }
            properties.put(field.name(), property);
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }
}
