package io.stagewise.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stagewise.adapter.langchain4j.LangChain4jModelFactory;
import io.stagewise.adapter.langchain4j.ModelRoles;
import io.stagewise.core.StagewiseConfig;
import io.stagewise.core.StagewiseEnvironment;
import io.stagewise.core.StagewiseFactory;
import io.stagewise.core.execution.RetryPolicy;
import io.stagewise.core.pipeline.PipelineConfig;
import io.stagewise.core.pipeline.SandboxBootstrap;
import io.stagewise.core.pipeline.StageOverrides;
import io.stagewise.core.pipeline.TurnLimitPolicy;
import io.stagewise.serialization.FileSystemCheckpointer;
import io.stagewise.server.persistence.JdbcCheckpointer;
import io.stagewise.server.sandbox.HttpSandboxClient;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the pipeline runtime.
///
/// Wires the core through {@link StagewiseFactory}: LangChain4j models, the HTTP sandbox, the
/// checkpoint store and per-stage overrides, all read from MicroProfile Config.
///
/// ### Credential Discovery
/// Credentials are loaded from (in priority order):
/// 1. **Application properties** under `stagewise.credentials.*`
/// 2. **Environment variables** matching `*_API_KEY`, `*_KEY`, `*_SECRET`, `*_TOKEN`
///
/// ### Configuration Properties
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `stagewise.models.agent` | Anthropic-first chain | agent model chain |
/// | `stagewise.models.objective` | OpenAI-first chain | objective model chain |
/// | `stagewise.models.selector` | `o4-mini, o4-mini` | selection model chain |
/// | `stagewise.models.reviewer` | `o3-mini, o3-mini` | checklist and report model chain |
/// | `stagewise.models.critics` | `o3, claude-opus-4-20250514` | the two critic models |
/// | `stagewise.models.timeout` | `PT120S` | per-call model timeout |
/// | `stagewise.sandbox.base-url` | - | code-execution service root, required |
/// | `stagewise.sandbox.execute-timeout` | `PT300S` | deadline of one code run |
/// | `stagewise.sandbox.directory` | `/tmp` | where preloaded artifacts are written |
/// | `stagewise.checkpoint.directory` | - | file store root, used without a datasource |
/// | `stagewise.thread-pool-size` | `10` | fan-out workers |
/// | `stagewise.session-pool-size` | `4` | concurrent session runs |
/// | `stagewise.retry.max-attempts` | `3` | node attempts before a run fails |
/// | `stagewise.stages.N.max-turns` | stage default | agent turn budget of stage N |
/// | `stagewise.stages.N.checklist` | stage default | checklist of stage N |
/// | `stagewise.stages.N.critic-guide` | stage default | critic rule of stage N |
/// | `stagewise.stages.N.turn-limit-policy` | stage default | `TERMINATE_RUN` or `CONTINUE_TO_VALIDATION` |
///
/// ### Checkpoint Store
/// PostgreSQL ({@link JdbcCheckpointer}) when a datasource is active, otherwise the file
/// store when `stagewise.checkpoint.directory` is set, otherwise in memory.
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
///
/// @see StagewiseEnvironment
/// @see StagewiseFactory
@ApplicationScoped
public class StagewiseEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(StagewiseEnvironmentProducer.class);

    static final String CREDENTIALS_PREFIX = StagewiseFactory.CREDENTIALS_PREFIX;
    static final int MAX_CONFIGURABLE_STAGE = 9;

    private StagewiseEnvironment environment;

    @Inject Config config;

    @Inject Instance<DataSource> dataSourceInstance;

    @Inject ObjectMapper objectMapper;

    /// Produces the runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @ApplicationScoped
    public StagewiseEnvironment stagewiseEnvironment() {
        StagewiseConfig stagewiseConfig = StagewiseConfig.builder()
                .threadPoolSize(config.getOptionalValue("stagewise.thread-pool-size", Integer.class).orElse(10))
                .sessionPoolSize(config.getOptionalValue("stagewise.session-pool-size", Integer.class).orElse(4))
                .retryPolicy(RetryPolicy.defaults()
                        .withMaxAttempts(config.getOptionalValue("stagewise.retry.max-attempts", Integer.class)
                                .orElse(RetryPolicy.DEFAULT_MAX_ATTEMPTS)))
                .pipelineConfig(pipelineConfig())
                .sandboxDirectory(config.getOptionalValue("stagewise.sandbox.directory", String.class)
                        .orElse(SandboxBootstrap.DEFAULT_DIRECTORY))
                .build();

        StagewiseFactory.Builder builder = StagewiseFactory.builder()
                .config(stagewiseConfig)
                .loadCredentials(extractCredentialProperties())
                .modelSuiteProvider(new LangChain4jModelFactory(
                        modelRoles(),
                        config.getOptionalValue("stagewise.models.timeout", Duration.class)
                                .orElse(Duration.ofSeconds(120))))
                .sandbox(new HttpSandboxClient(
                        config.getValue("stagewise.sandbox.base-url", String.class),
                        objectMapper,
                        config.getOptionalValue("stagewise.sandbox.execute-timeout", Duration.class)
                                .orElse(Duration.ofSeconds(300))));

        boolean dsActive = config.getOptionalValue("quarkus.datasource.active", Boolean.class).orElse(true);
        Optional<String> checkpointDirectory =
                config.getOptionalValue("stagewise.checkpoint.directory", String.class);
        if (dsActive && dataSourceInstance.isResolvable()) {
            builder.checkpointer(new JdbcCheckpointer(dataSourceInstance.get()));
            LOG.info("Using JDBC checkpoints (PostgreSQL)");
        } else if (checkpointDirectory.isPresent()) {
            builder.checkpointer(new FileSystemCheckpointer(Path.of(checkpointDirectory.get())));
            LOG.infov("Using file checkpoints in {0}", checkpointDirectory.get());
        } else {
            LOG.info("Using in-memory checkpoints");
        }

        environment = builder.build();
        LOG.info("Configured StagewiseEnvironment via StagewiseFactory");
        return environment;
    }

    /// Reads the model chains, falling back to the defaults role by role.
    ModelRoles modelRoles() {
        ModelRoles defaults = ModelRoles.defaults();
        return new ModelRoles(
                config.getOptionalValue("stagewise.models.agent", String.class)
                        .map(ModelChains::parse)
                        .orElse(defaults.agent()),
                config.getOptionalValue("stagewise.models.objective", String.class)
                        .map(ModelChains::parse)
                        .orElse(defaults.objective()),
                config.getOptionalValue("stagewise.models.selector", String.class)
                        .map(ModelChains::parse)
                        .orElse(defaults.selector()),
                config.getOptionalValue("stagewise.models.reviewer", String.class)
                        .map(ModelChains::parse)
                        .orElse(defaults.reviewer()),
                config.getOptionalValue("stagewise.models.critics", String.class)
                        .map(ModelChains::parse)
                        .orElse(defaults.critics()));
    }

    /// Reads `stagewise.stages.N.*` overrides.
    PipelineConfig pipelineConfig() {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        for (int order = 1; order <= MAX_CONFIGURABLE_STAGE; order++) {
            String prefix = "stagewise.stages." + order + ".";
            Integer maxTurns = config.getOptionalValue(prefix + "max-turns", Integer.class).orElse(null);
            String checklist = config.getOptionalValue(prefix + "checklist", String.class).orElse(null);
            String criticGuide = config.getOptionalValue(prefix + "critic-guide", String.class).orElse(null);
            TurnLimitPolicy policy = config.getOptionalValue(prefix + "turn-limit-policy", String.class)
                    .map(value -> TurnLimitPolicy.valueOf(value.strip().toUpperCase(Locale.ROOT)))
                    .orElse(null);
            if (maxTurns != null || checklist != null || criticGuide != null || policy != null) {
                builder.stage(order, new StageOverrides(maxTurns, checklist, criticGuide, policy));
                LOG.infov("Stage {0} overrides configured", order);
            }
        }
        return builder.build();
    }

    /// Extracts `stagewise.credentials.*` from Quarkus config.
    Properties extractCredentialProperties() {
        Properties properties = new Properties();
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(value -> properties.setProperty(propertyName, value));
            }
        }
        return properties;
    }

    /// Closes the environment on shutdown, cancelling running sessions and stopping its pools.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("StagewiseEnvironment closed");
        }
    }
}
