package io.stagewise.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Stage-scoped working state, discarded once the stage report is written.
///
/// @param conversation ordered conversation of the active stage, never null
/// @param pendingCode code extracted from the last agent turn, null when none is pending
/// @param selections values chosen to persist beyond the stage, never null
/// @param checklistResult checklist validator verdict, null until validated
/// @param criticResults critic verdicts in identity order, never null (empty until validated)
/// @param assessment latest objective assessment, null outside the objective stage
/// @param turnLimitReached whether the stage exhausted its message budget
public record StageScratch(
        List<ChatMessage> conversation,
        String pendingCode,
        List<ArtifactSelection> selections,
        ValidationResult checklistResult,
        List<ValidationResult> criticResults,
        ObjectiveAssessment assessment,
        boolean turnLimitReached) {

    public static final StageScratch EMPTY =
            new StageScratch(List.of(), null, List.of(), null, List.of(), null, false);

    public StageScratch {
        conversation = conversation != null ? immutable(conversation) : List.of();
        selections = selections != null ? List.copyOf(selections) : List.of();
        criticResults = criticResults != null ? List.copyOf(criticResults) : List.of();
    }

    /// Returns whether a checklist verdict is present and passed.
    ///
    /// @return true if the checklist passed
    public boolean checklistPassed() {
        return checklistResult != null && checklistResult.passed();
    }

    /// Returns whether critic verdicts are present and all passed.
    ///
    /// @return true if at least one critic result exists and every one passed
    public boolean allCriticsPassed() {
        return !criticResults.isEmpty() && criticResults.stream().allMatch(ValidationResult::passed);
    }

    private static List<ChatMessage> immutable(List<ChatMessage> messages) {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }
}
