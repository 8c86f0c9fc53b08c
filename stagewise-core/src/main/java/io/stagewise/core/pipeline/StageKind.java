package io.stagewise.core.pipeline;

/// Shape of a stage sub-graph.
public enum StageKind {
    /// Assess and clarify the objective with the user; checklist validation only.
    OBJECTIVE,
    /// Agent and sandbox loop with checklist and critic validation.
    CODE,
    /// Single node writing the final report.
    REPORT
}
