package io.stagewise.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stagewise.serialization.StateSerializer;
import io.stagewise.server.data.CsvTableLoader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI configuration for server-specific beans.
///
/// The pipeline runtime itself is produced by {@link StagewiseEnvironmentProducer}.
@ApplicationScoped
public class ServerConfiguration {

    /// Mapper with the artifact and table codecs, so REST bodies carry typed artifacts.
    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return StateSerializer.createMapper();
    }

    @Produces
    @Singleton
    public CsvTableLoader csvTableLoader(
            @ConfigProperty(name = "stagewise.data.directory", defaultValue = "data") String dataDirectory) {
        return new CsvTableLoader(Path.of(dataDirectory));
    }
}
