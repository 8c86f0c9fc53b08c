package io.stagewise.core;

import io.stagewise.core.checkpoint.Checkpointer;
import io.stagewise.core.checkpoint.InMemoryCheckpointer;
import io.stagewise.core.execution.GraphExecutor;
import io.stagewise.core.execution.RetryExecutor;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.llm.ModelSuite;
import io.stagewise.core.llm.ModelSuiteProvider;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.pipeline.SandboxBootstrap;
import io.stagewise.core.pipeline.StageOrchestrator;
import io.stagewise.core.sandbox.Sandbox;
import io.stagewise.core.session.PipelineRunner;
import io.stagewise.core.session.SessionRegistry;
import io.stagewise.core.template.SimpleTemplateResolver;
import io.stagewise.core.template.TemplateResolver;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for wiring {@link StagewiseEnvironment} instances.
///
/// ### Usage
/// {@snippet :
/// var env = StagewiseFactory.builder()
///     .config(StagewiseConfig.builder().threadPoolSize(8).build())
///     .loadCredentials(properties)
///     .modelSuiteProvider(new LangChain4jModelFactory(roles))
///     .sandbox(sandbox)
///     .build();
/// }
///
/// @see StagewiseEnvironment
/// @see StagewiseConfig
public final class StagewiseFactory {

    private static final Logger logger = Logger.getLogger(StagewiseFactory.class.getName());

    public static final String CREDENTIALS_PREFIX = "stagewise.credentials.";

    private StagewiseFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Discovers API credentials from environment variables ending in `_API_KEY`, `_KEY`,
    /// `_SECRET` or `_TOKEN`.
    ///
    /// @return discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return credentialsFrom(System.getenv());
    }

    static Map<String, String> credentialsFrom(Map<String, String> environment) {
        Map<String, String> credentials = new HashMap<>();
        environment.forEach((key, value) -> {
            if (value != null && !value.isEmpty() && isApiKeyPattern(key)) {
                credentials.put(key, value);
            }
        });
        return credentials;
    }

    /// Loads credentials from properties.
    ///
    /// Keys under `stagewise.credentials.` are taken with the prefix stripped; keys that look
    /// like API key names are taken as is.
    ///
    /// @param properties source properties, not null
    /// @return credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        properties.forEach((key, value) -> {
            String name = key.toString();
            String text = value.toString();
            if (text.isEmpty()) {
                return;
            }
            if (name.startsWith(CREDENTIALS_PREFIX)) {
                credentials.put(name.substring(CREDENTIALS_PREFIX.length()), text);
            } else if (isApiKeyPattern(name)) {
                credentials.put(name, text);
            }
        });
        return credentials;
    }

    /// Loads credentials from the environment and from properties; properties win.
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upper = key.toUpperCase(Locale.ROOT);
        return upper.endsWith("_API_KEY")
                || upper.endsWith("_KEY")
                || upper.endsWith("_SECRET")
                || upper.endsWith("_TOKEN");
    }

    /// Fluent builder for {@link StagewiseEnvironment}.
    ///
    /// A sandbox and either a model suite or a model suite provider are required.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private StagewiseConfig config = new StagewiseConfig();
        private final Map<String, String> credentials = new HashMap<>();
        private ModelSuite modelSuite;
        private ModelSuiteProvider modelSuiteProvider;
        private Sandbox sandbox;
        private Checkpointer checkpointer;
        private TemplateResolver templateResolver;
        private PipelineDefinition definition;
        private ExecutorService nodeExecutor;
        private ExecutorService sessionExecutor;

        private Builder() {}

        public Builder config(StagewiseConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Adds credentials from the environment and the given properties.
        public Builder loadCredentials(Properties properties) {
            credentials.putAll(StagewiseFactory.loadCredentials(properties));
            return this;
        }

        /// Uses a ready-made suite; takes precedence over a provider.
        public Builder modelSuite(ModelSuite modelSuite) {
            this.modelSuite = modelSuite;
            return this;
        }

        public Builder modelSuiteProvider(ModelSuiteProvider modelSuiteProvider) {
            this.modelSuiteProvider = modelSuiteProvider;
            return this;
        }

        public Builder sandbox(Sandbox sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        /// Sets the checkpoint store; defaults to {@link InMemoryCheckpointer}.
        public Builder checkpointer(Checkpointer checkpointer) {
            this.checkpointer = checkpointer;
            return this;
        }

        public Builder templateResolver(TemplateResolver templateResolver) {
            this.templateResolver = templateResolver;
            return this;
        }

        /// Replaces the default five-stage definition; config overrides still apply.
        public Builder definition(PipelineDefinition definition) {
            this.definition = definition;
            return this;
        }

        public Builder nodeExecutor(ExecutorService nodeExecutor) {
            this.nodeExecutor = nodeExecutor;
            return this;
        }

        public Builder sessionExecutor(ExecutorService sessionExecutor) {
            this.sessionExecutor = sessionExecutor;
            return this;
        }

        /// Wires the environment.
        ///
        /// @return the environment, never null
        /// @throws IllegalStateException if the sandbox or the models are missing
        public StagewiseEnvironment build() {
            if (sandbox == null) {
                throw new IllegalStateException("A sandbox is required");
            }
            ModelSuite models = modelSuite;
            if (models == null) {
                if (modelSuiteProvider == null) {
                    throw new IllegalStateException("A model suite or a model suite provider is required");
                }
                models = modelSuiteProvider.create(Map.copyOf(credentials));
            }

            PipelineDefinition configured = (definition != null ? definition : PipelineDefinition.defaults())
                    .configure(config.getPipelineConfig());
            Checkpointer store = checkpointer != null ? checkpointer : new InMemoryCheckpointer();
            TemplateResolver templates = templateResolver != null ? templateResolver : new SimpleTemplateResolver();
            ExecutorService nodes = nodeExecutor != null
                    ? nodeExecutor
                    : Executors.newFixedThreadPool(config.getThreadPoolSize());
            ExecutorService sessions = sessionExecutor != null
                    ? sessionExecutor
                    : Executors.newFixedThreadPool(config.getSessionPoolSize());

            Graph graph = new StageOrchestrator(
                            configured,
                            models,
                            sandbox,
                            new SandboxBootstrap(config.getSandboxDirectory()),
                            templates,
                            config.getRetryPolicy())
                    .build();
            GraphExecutor executor = new GraphExecutor(nodes, store, new RetryExecutor());
            SessionRegistry registry = new SessionRegistry();
            PipelineRunner runner = new PipelineRunner(executor, graph, configured, store, registry, sessions);

            logger.info("Stagewise environment ready: " + configured.stages().size() + " stages, "
                    + graph.nodeIds().size() + " nodes");
            return new StagewiseEnvironment(runner, configured, graph, store, registry, nodes, sessions);
        }
    }
}
