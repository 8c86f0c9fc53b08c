package io.stagewise.core.state;

/// Per-run flags supplied by the caller that starts a pipeline.
///
/// Stored in {@link PipelineState} so a resumed run keeps the flags it started with.
///
/// @param skipFirstStage mark the objective stage as done before routing
/// @param useHumanInTheLoop suspend at every rendezvous for a human decision
public record RunOptions(boolean skipFirstStage, boolean useHumanInTheLoop) {

    public static RunOptions defaults() {
        return new RunOptions(false, false);
    }
}
