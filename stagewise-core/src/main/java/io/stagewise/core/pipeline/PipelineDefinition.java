package io.stagewise.core.pipeline;

import io.stagewise.core.state.Stage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Ordered stage definitions of a pipeline.
///
/// {@link #defaults()} holds the five-stage data analysis pipeline:
///
/// | Order | Stage | Kind | Turns |
/// |-------|-------|------|-------|
/// | 1 | Define the Objective | OBJECTIVE | 3 |
/// | 2 | Data Cleaning | CODE | 30 |
/// | 3 | Data Exploration | CODE | 30 |
/// | 4 | Data Analysis & Visualization | CODE | 50 |
/// | 5 | Write Report | REPORT | - |
public final class PipelineDefinition {

    static final String OBJECTIVE_CHECKLIST = """
            - Is there any ambiguous term used?
            - Did the user say what they want at the end of the analysis?
            - Did the user give a high level method to reach the objective?""";

    static final String CLEANING_CHECKLIST = """
            - Address missing values
            - Address duplicate records
            - Address inconsistent formatting
            - Address inconsistent naming conventions
            - Address outliers
            - Address data type mismatches""";

    private final List<StageDefinition> stages;

    public PipelineDefinition(List<StageDefinition> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        List<StageDefinition> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(StageDefinition::order));
        Set<Integer> orders = new HashSet<>();
        Set<String> scopes = new HashSet<>();
        for (StageDefinition stage : sorted) {
            if (!orders.add(stage.order()) || !scopes.add(stage.scope())) {
                throw new IllegalArgumentException("Duplicate stage order or scope: " + stage.label());
            }
        }
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        this.stages = List.copyOf(sorted);
    }

    public static PipelineDefinition defaults() {
        return new PipelineDefinition(List.of(
                new StageDefinition(1, "stage_1", "Define the Objective",
                        "Understand the problem and set goals", StageKind.OBJECTIVE, 3,
                        OBJECTIVE_CHECKLIST, "", Prompts.OBJECTIVE_INSTRUCTIONS,
                        TurnLimitPolicy.TERMINATE_RUN),
                new StageDefinition(2, "stage_2", "Data Cleaning",
                        "Handle missing data, fix errors, and filter irrelevant data", StageKind.CODE, 30,
                        CLEANING_CHECKLIST, "", Prompts.CLEANING_INSTRUCTIONS,
                        TurnLimitPolicy.CONTINUE_TO_VALIDATION),
                new StageDefinition(3, "stage_3", "Data Exploration",
                        "Summarize data and find anomalies/outliers", StageKind.CODE, 30,
                        "", "", Prompts.EXPLORATION_INSTRUCTIONS,
                        TurnLimitPolicy.CONTINUE_TO_VALIDATION),
                new StageDefinition(4, "stage_4", "Data Analysis & Visualization",
                        "", StageKind.CODE, 50,
                        "", "", Prompts.ANALYSIS_INSTRUCTIONS,
                        TurnLimitPolicy.CONTINUE_TO_VALIDATION),
                new StageDefinition(5, "stage_5", "Write Report",
                        "", StageKind.REPORT, 1,
                        "", "", Prompts.FINAL_REPORT_INSTRUCTIONS,
                        TurnLimitPolicy.CONTINUE_TO_VALIDATION)));
    }

    /// Returns a copy with configuration overrides applied.
    ///
    /// @param config configuration, not null
    /// @return configured definition, never null
    public PipelineDefinition configure(PipelineConfig config) {
        return new PipelineDefinition(
                stages.stream().map(s -> s.with(config.overridesFor(s.order()))).toList());
    }

    public List<StageDefinition> stages() {
        return stages;
    }

    public StageDefinition stage(int order) {
        return stages.stream()
                .filter(s -> s.order() == order)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage with order " + order));
    }

    /// Returns pending descriptors for a new run.
    public List<Stage> initialStages() {
        return stages.stream().map(StageDefinition::toPendingStage).toList();
    }
}
