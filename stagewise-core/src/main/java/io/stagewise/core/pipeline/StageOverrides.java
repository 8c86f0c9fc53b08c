package io.stagewise.core.pipeline;

/// Per-stage configuration overrides; null fields keep the stage default.
///
/// @param maxMessageTurns agent turn budget
/// @param checklist checklist text
/// @param criticGuide critic rule text
/// @param turnLimitPolicy behaviour when the budget is exhausted
public record StageOverrides(
        Integer maxMessageTurns, String checklist, String criticGuide, TurnLimitPolicy turnLimitPolicy) {

    public static final StageOverrides NONE = new StageOverrides(null, null, null, null);

    public static StageOverrides maxTurns(int maxMessageTurns) {
        return new StageOverrides(maxMessageTurns, null, null, null);
    }
}
