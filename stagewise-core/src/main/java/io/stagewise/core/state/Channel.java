package io.stagewise.core.state;

/// Writable fields of {@link PipelineState}, each merged by its own reducer.
///
/// Accumulating channels may receive writes from several branches of the same superstep;
/// the others are single-writer per superstep.
public enum Channel {
    OBJECTIVE(false),
    STAGES(true),
    ARTIFACTS(true),
    SESSION_HANDLE(false),
    SCRATCH_RESET(false),
    CONVERSATION(true),
    PENDING_CODE(false),
    SELECTIONS(false),
    CHECKLIST_RESULT(false),
    CRITIC_RESULTS(false),
    ASSESSMENT(false),
    TURN_LIMIT(false),
    FINAL_REPORT(false);

    private final boolean accumulating;

    Channel(boolean accumulating) {
        this.accumulating = accumulating;
    }

    public boolean isAccumulating() {
        return accumulating;
    }
}
