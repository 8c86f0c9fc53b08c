package io.stagewise.core.llm;

import java.util.List;
import java.util.Objects;

/// One field of an {@link OutputSchema}.
///
/// @param name field name in the generated object, not null
/// @param type value type, not null
/// @param description guidance for the model, never null
/// @param required whether the field must be present
/// @param itemFields fields of each element when `type` is {@link FieldType#OBJECT_LIST}
public record SchemaField(
        String name, FieldType type, String description, boolean required, List<SchemaField> itemFields) {

    public SchemaField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        description = description != null ? description : "";
        itemFields = itemFields != null ? List.copyOf(itemFields) : List.of();
        if (type == FieldType.OBJECT_LIST && itemFields.isEmpty()) {
            throw new IllegalArgumentException("List field '" + name + "' needs item fields");
        }
    }

    public static SchemaField string(String name, String description) {
        return new SchemaField(name, FieldType.STRING, description, true, null);
    }

    public static SchemaField optionalString(String name, String description) {
        return new SchemaField(name, FieldType.STRING, description, false, null);
    }

    public static SchemaField bool(String name, String description) {
        return new SchemaField(name, FieldType.BOOLEAN, description, true, null);
    }

    public static SchemaField objectList(String name, String description, SchemaField... items) {
        return new SchemaField(name, FieldType.OBJECT_LIST, description, true, List.of(items));
    }
}
