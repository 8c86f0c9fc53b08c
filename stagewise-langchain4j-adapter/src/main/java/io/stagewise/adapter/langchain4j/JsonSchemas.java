package io.stagewise.adapter.langchain4j;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import io.stagewise.core.llm.OutputSchema;
import io.stagewise.core.llm.SchemaField;
import java.util.ArrayList;
import java.util.List;

/// Converts {@link OutputSchema} descriptions to LangChain4j JSON schemas.
final class JsonSchemas {

    private JsonSchemas() {}

    static JsonSchema of(OutputSchema<?> schema) {
        return JsonSchema.builder()
                .name(schema.name())
                .rootElement(object(schema.description(), schema.fields()))
                .build();
    }

    private static JsonObjectSchema object(String description, List<SchemaField> fields) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
        List<String> required = new ArrayList<>();
        for (SchemaField field : fields) {
            builder.addProperty(field.name(), element(field));
            if (field.required()) {
                required.add(field.name());
            }
        }
        return builder.required(required).build();
    }

    private static JsonSchemaElement element(SchemaField field) {
        return switch (field.type()) {
            case STRING -> JsonStringSchema.builder().description(field.description()).build();
            case BOOLEAN -> JsonBooleanSchema.builder().description(field.description()).build();
            case NUMBER -> JsonNumberSchema.builder().description(field.description()).build();
            case OBJECT_LIST -> JsonArraySchema.builder()
                    .description(field.description())
                    .items(object(field.description(), field.itemFields()))
                    .build();
        };
    }
}
