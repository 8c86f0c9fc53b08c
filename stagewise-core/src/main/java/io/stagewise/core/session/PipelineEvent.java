package io.stagewise.core.session;

/// Caller-facing notification about a running session.
///
/// Events of one session are published in the order they happen. A run ends with exactly one
/// of {@link InputRequired}, {@link Completed}, {@link Failed} or {@link Cancelled}.
public sealed interface PipelineEvent {

    String sessionId();

    /// One-line progress message from a node.
    record Progress(String sessionId, String message) implements PipelineEvent {}

    /// A stage began; `stage` is its order.
    record StageStarted(String sessionId, int stage) implements PipelineEvent {}

    /// The run is waiting for the user; answer with a resume value.
    record InputRequired(String sessionId, String message) implements PipelineEvent {

        public static final String PROMPT = "Please answer this question!";
    }

    /// The run finished; `finalReport` may be null when the run ended without a report.
    record Completed(String sessionId, String finalReport) implements PipelineEvent {

        public static final String TITLE = "Analysis Complete";
    }

    /// The run stopped on a fatal error.
    record Failed(String sessionId, String error) implements PipelineEvent {

        public static final String PREFIX = "An error occurred during analysis: ";

        public String message() {
            return PREFIX + error;
        }
    }

    record Cancelled(String sessionId) implements PipelineEvent {}
}
