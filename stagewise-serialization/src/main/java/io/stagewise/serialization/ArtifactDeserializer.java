package io.stagewise.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ArtifactKind;
import java.io.IOException;
import java.io.Serial;

/// Reads the form written by {@link ArtifactSerializer}.
///
/// @implNote Package-private. Registered by {@link StagewiseJacksonModule}.
class ArtifactDeserializer extends StdDeserializer<Artifact> {

    @Serial private static final long serialVersionUID = -6084415202385170147L;

    ArtifactDeserializer() {
        super(Artifact.class);
    }

    @Override
    public Artifact deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        JsonNode key = root.get("key");
        JsonNode kind = root.get("kind");
        if (key == null || kind == null) {
            throw new IOException("Artifact requires 'key' and 'kind'");
        }
        try {
            return new Artifact(
                    key.asText(),
                    ArtifactKind.fromWireName(kind.asText()),
                    root.path("description").asText(""),
                    TypedValueCodec.read(root.get("value"), mapper));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid artifact '" + key.asText() + "': " + e.getMessage(), e);
        }
    }
}
