package io.stagewise.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stagewise.core.state.Table;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Serializes a {@link Table} as `{"columns": [...], "rows": [[...], ...]}`.
///
/// Cells are already normalized by the table to strings, longs, doubles, booleans, nulls or
/// nested maps and lists. Infinite doubles have no JSON number form and are written as
/// `{"$double": "Infinity"}` (or `"-Infinity"`), at any nesting depth.
///
/// @implNote Package-private. Registered by {@link StagewiseJacksonModule}.
/// @see TableDeserializer for the inverse operation
class TableSerializer extends StdSerializer<Table> {

    @Serial private static final long serialVersionUID = 5514827359160274410L;

    static final String NON_FINITE_DOUBLE = "$double";

    TableSerializer() {
        super(Table.class);
    }

    @Override
    public void serialize(Table table, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        writeBody(table, gen, provider);
        gen.writeEndObject();
    }

    static void writeBody(Table table, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeArrayFieldStart("columns");
        for (String column : table.columns()) {
            gen.writeString(column);
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("rows");
        for (List<Object> row : table.rows()) {
            gen.writeStartArray();
            for (Object cell : row) {
                writeCell(cell, gen, provider);
            }
            gen.writeEndArray();
        }
        gen.writeEndArray();
    }

    private static void writeCell(Object cell, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (cell instanceof Double d && d.isInfinite()) {
            gen.writeStartObject();
            gen.writeStringField(NON_FINITE_DOUBLE, d.toString());
            gen.writeEndObject();
        } else if (cell instanceof Map<?, ?> map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                gen.writeFieldName(String.valueOf(entry.getKey()));
                writeCell(entry.getValue(), gen, provider);
            }
            gen.writeEndObject();
        } else if (cell instanceof List<?> list) {
            gen.writeStartArray();
            for (Object item : list) {
                writeCell(item, gen, provider);
            }
            gen.writeEndArray();
        } else {
            provider.defaultSerializeValue(cell, gen);
        }
    }
}
