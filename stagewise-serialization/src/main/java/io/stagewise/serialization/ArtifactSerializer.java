package io.stagewise.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stagewise.core.state.Artifact;
import java.io.IOException;
import java.io.Serial;

/// Serializes an {@link Artifact} with its kind and a tagged value.
///
/// ```
/// {"key": "df", "kind": "dataframe", "description": "...", "value": {"type": "table", ...}}
/// ```
///
/// @implNote Package-private. Registered by {@link StagewiseJacksonModule}.
/// @see ArtifactDeserializer for the inverse operation
class ArtifactSerializer extends StdSerializer<Artifact> {

    @Serial private static final long serialVersionUID = 2209141713862339160L;

    ArtifactSerializer() {
        super(Artifact.class);
    }

    @Override
    public void serialize(Artifact artifact, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("key", artifact.key());
        gen.writeStringField("kind", artifact.kind().wireName());
        gen.writeStringField("description", artifact.description());
        gen.writeFieldName("value");
        TypedValueCodec.write(artifact.value(), gen, provider);
        gen.writeEndObject();
    }
}
