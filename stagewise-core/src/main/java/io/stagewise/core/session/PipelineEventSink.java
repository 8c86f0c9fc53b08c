package io.stagewise.core.session;

/// Receives {@link PipelineEvent}s of a session.
///
/// @implNote Called from executor threads, including fan-out workers; implementations must be
/// thread-safe and must not block.
@FunctionalInterface
public interface PipelineEventSink {

    void publish(PipelineEvent event);

    /// Sink that discards every event.
    PipelineEventSink NOOP = event -> {};
}
