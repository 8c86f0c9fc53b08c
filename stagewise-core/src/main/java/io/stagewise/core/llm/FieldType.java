package io.stagewise.core.llm;

/// Value types a structured-output field may declare.
public enum FieldType {
    STRING("string"),
    BOOLEAN("boolean"),
    NUMBER("number"),
    OBJECT_LIST("array");

    private final String jsonType;

    FieldType(String jsonType) {
        this.jsonType = jsonType;
    }

    public String jsonType() {
        return jsonType;
    }
}
