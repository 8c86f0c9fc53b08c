package io.stagewise.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.stagewise.core.state.Table;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Writes and reads arbitrary artifact values as tagged JSON.
///
/// ```
/// type    │ value
/// ────────┼─────────────────────────────────────────────
/// null    │ (none)
/// table   │ columns: [..], rows: [[..], ..]
/// string  │ JSON string
/// boolean │ JSON boolean
/// number  │ JSON number, numberType long|double|decimal|integer
/// json    │ nested maps, lists and scalars
/// binary  │ base64 bytes (images)
/// opaque  │ class name + base64 Java serialization
/// ```
///
/// Opaque values are only read back when every class in the stream is a `java.*` class or the
/// declared class itself.
///
/// @implNote Package-private. Used by {@link ArtifactSerializer} and {@link ArtifactDeserializer}.
final class TypedValueCodec {

    static final String TYPE = "type";
    static final String VALUE = "value";

    private TypedValueCodec() {}

    static void write(Object value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (value == null) {
            gen.writeStringField(TYPE, "null");
        } else if (value instanceof Table table) {
            gen.writeStringField(TYPE, "table");
            TableSerializer.writeBody(table, gen, provider);
        } else if (value instanceof String s) {
            gen.writeStringField(TYPE, "string");
            gen.writeStringField(VALUE, s);
        } else if (value instanceof Boolean b) {
            gen.writeStringField(TYPE, "boolean");
            gen.writeBooleanField(VALUE, b);
        } else if (value instanceof Number n) {
            gen.writeStringField(TYPE, "number");
            writeNumber(n, gen);
        } else if (value instanceof Map<?, ?> || value instanceof List<?>) {
            gen.writeStringField(TYPE, "json");
            gen.writeFieldName(VALUE);
            provider.defaultSerializeValue(value, gen);
        } else if (value instanceof byte[] bytes) {
            gen.writeStringField(TYPE, "binary");
            gen.writeStringField(VALUE, Base64.getEncoder().encodeToString(bytes));
        } else if (value instanceof Serializable serializable) {
            gen.writeStringField(TYPE, "opaque");
            gen.writeStringField("class", value.getClass().getName());
            gen.writeStringField(VALUE, Base64.getEncoder().encodeToString(javaSerialize(serializable)));
        } else {
            throw new IOException("Cannot serialize value of type " + value.getClass().getName());
        }
        gen.writeEndObject();
    }

    static Object read(JsonNode node, ObjectMapper mapper) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        String type = node.path(TYPE).asText("");
        JsonNode value = node.get(VALUE);
        return switch (type) {
            case "null" -> null;
            case "table" -> TableDeserializer.readBody(node, mapper);
            case "string" -> value.asText();
            case "boolean" -> value.asBoolean();
            case "number" -> readNumber(node.path("numberType").asText("double"), value);
            case "json" -> plain(value);
            case "binary" -> Base64.getDecoder().decode(value.asText());
            case "opaque" -> javaDeserialize(
                    node.path("class").asText(), Base64.getDecoder().decode(value.asText()));
            default -> throw new IOException("Unknown value type: " + type);
        };
    }

    /// Converts a JSON tree to maps, lists and scalars.
    static Object plain(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), plain(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(item -> list.add(plain(item)));
            return list;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private static void writeNumber(Number n, JsonGenerator gen) throws IOException {
        if (n instanceof Double || n instanceof Float) {
            gen.writeStringField("numberType", "double");
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                gen.writeStringField(VALUE, Double.toString(d));
            } else {
                gen.writeNumberField(VALUE, d);
            }
        } else if (n instanceof BigDecimal bd) {
            gen.writeStringField("numberType", "decimal");
            gen.writeStringField(VALUE, bd.toPlainString());
        } else if (n instanceof BigInteger bi) {
            gen.writeStringField("numberType", "integer");
            gen.writeStringField(VALUE, bi.toString());
        } else {
            gen.writeStringField("numberType", "long");
            gen.writeNumberField(VALUE, n.longValue());
        }
    }

    private static Object readNumber(String numberType, JsonNode value) {
        return switch (numberType) {
            case "long" -> value.asLong();
            case "decimal" -> new BigDecimal(value.asText());
            case "integer" -> new BigInteger(value.asText());
            default -> value.isTextual() ? Double.parseDouble(value.asText()) : value.asDouble();
        };
    }

    private static byte[] javaSerialize(Serializable value) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        return bytes.toByteArray();
    }

    private static Object javaDeserialize(String declaredClass, byte[] data) throws IOException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            in.setObjectInputFilter(info -> allowed(info, declaredClass));
            return in.readObject();
        } catch (InvalidClassException e) {
            throw new IOException("Rejected opaque value of class " + declaredClass, e);
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown opaque value class " + declaredClass, e);
        }
    }

    private static ObjectInputFilter.Status allowed(ObjectInputFilter.FilterInfo info, String declaredClass) {
        Class<?> type = info.serialClass();
        if (type == null) {
            return ObjectInputFilter.Status.UNDECIDED;
        }
        while (type.isArray()) {
            type = type.getComponentType();
        }
        if (type.isPrimitive() || type.getName().startsWith("java.") || type.getName().equals(declaredClass)) {
            return ObjectInputFilter.Status.ALLOWED;
        }
        return ObjectInputFilter.Status.REJECTED;
    }
}
