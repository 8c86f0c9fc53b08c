package io.stagewise.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stagewise.core.state.Table;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads the `{"columns", "rows"}` form written by {@link TableSerializer}.
///
/// @implNote Package-private. Registered by {@link StagewiseJacksonModule}.
class TableDeserializer extends StdDeserializer<Table> {

    @Serial private static final long serialVersionUID = -1968344015620470371L;

    TableDeserializer() {
        super(Table.class);
    }

    @Override
    public Table deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return readBody(mapper.readTree(p), mapper);
    }

    static Table readBody(JsonNode node, ObjectMapper mapper) throws IOException {
        JsonNode columnsNode = node.get("columns");
        JsonNode rowsNode = node.get("rows");
        if (columnsNode == null || !columnsNode.isArray() || rowsNode == null || !rowsNode.isArray()) {
            throw new IOException("Table requires 'columns' and 'rows' arrays");
        }
        List<String> columns = new ArrayList<>(columnsNode.size());
        columnsNode.forEach(c -> columns.add(c.asText()));
        List<List<Object>> rows = new ArrayList<>(rowsNode.size());
        for (JsonNode rowNode : rowsNode) {
            List<Object> row = new ArrayList<>(rowNode.size());
            rowNode.forEach(cell -> row.add(readCell(cell)));
            rows.add(row);
        }
        try {
            return new Table(columns, rows);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid table: " + e.getMessage(), e);
        }
    }

    private static Object readCell(JsonNode node) {
        if (node.isObject()) {
            JsonNode nonFinite = node.get(TableSerializer.NON_FINITE_DOUBLE);
            if (node.size() == 1 && nonFinite != null && nonFinite.isTextual()) {
                return Double.parseDouble(nonFinite.asText());
            }
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), readCell(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(item -> list.add(readCell(item)));
            return list;
        }
        return TypedValueCodec.plain(node);
    }
}
