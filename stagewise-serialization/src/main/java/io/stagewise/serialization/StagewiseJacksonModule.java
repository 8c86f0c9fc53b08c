package io.stagewise.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.Table;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the stagewise serialization configuration.
///
/// **Custom serializer/deserializer pairs**:
/// - `Artifact`: `ArtifactSerializer` / `ArtifactDeserializer`, the value carries a `"type"`
///   tag (see `TypedValueCodec`)
/// - `Table`: `TableSerializer` / `TableDeserializer`, `columns` + `rows`
///
/// Every other state type is a record and binds through its canonical constructor, so the
/// validation in compact constructors also runs on load.
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see StateSerializer for the convenience factory API
public class StagewiseJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4620318843721765902L;

    public StagewiseJacksonModule() {
        super("StagewiseJacksonModule");

        addSerializer(Artifact.class, new ArtifactSerializer());
        addDeserializer(Artifact.class, new ArtifactDeserializer());

        addSerializer(Table.class, new TableSerializer());
        addDeserializer(Table.class, new TableDeserializer());
    }
}
