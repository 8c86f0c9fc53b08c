package io.stagewise.core;

import io.stagewise.core.execution.RetryPolicy;
import io.stagewise.core.pipeline.PipelineConfig;
import io.stagewise.core.pipeline.SandboxBootstrap;

/// Configuration options for a stagewise environment.
///
/// ### Default Values
/// - `threadPoolSize`: `10` (fan-out branches)
/// - `sessionPoolSize`: `4` (asynchronous session calls)
/// - `retryPolicy`: {@link RetryPolicy#defaults()}
/// - `pipelineConfig`: {@link PipelineConfig#DEFAULT}
/// - `sandboxDirectory`: `/tmp`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link StagewiseFactory} and do
/// not modify afterwards.
public class StagewiseConfig {
    private int threadPoolSize = 10;
    private int sessionPoolSize = 4;
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private PipelineConfig pipelineConfig = PipelineConfig.DEFAULT;
    private String sandboxDirectory = SandboxBootstrap.DEFAULT_DIRECTORY;

    public StagewiseConfig() {}

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the size of the pool that runs fan-out branches.
    ///
    /// @param threadPoolSize number of threads, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public int getSessionPoolSize() {
        return sessionPoolSize;
    }

    public void setSessionPoolSize(int sessionPoolSize) {
        this.sessionPoolSize = sessionPoolSize;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /// Sets the retry policy of every node except code execution, which never retries.
    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    public PipelineConfig getPipelineConfig() {
        return pipelineConfig;
    }

    public void setPipelineConfig(PipelineConfig pipelineConfig) {
        this.pipelineConfig = pipelineConfig;
    }

    public String getSandboxDirectory() {
        return sandboxDirectory;
    }

    /// Sets the sandbox directory that artifact files are written to.
    public void setSandboxDirectory(String sandboxDirectory) {
        this.sandboxDirectory = sandboxDirectory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link StagewiseConfig}.
    public static class Builder {
        private final StagewiseConfig config = new StagewiseConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder sessionPoolSize(int sessionPoolSize) {
            config.sessionPoolSize = sessionPoolSize;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            config.retryPolicy = retryPolicy;
            return this;
        }

        public Builder pipelineConfig(PipelineConfig pipelineConfig) {
            config.pipelineConfig = pipelineConfig;
            return this;
        }

        public Builder sandboxDirectory(String sandboxDirectory) {
            config.sandboxDirectory = sandboxDirectory;
            return this;
        }

        public StagewiseConfig build() {
            return config;
        }
    }
}
