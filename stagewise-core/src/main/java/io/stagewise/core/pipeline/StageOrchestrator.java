package io.stagewise.core.pipeline;

import io.stagewise.core.execution.RetryPolicy;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.llm.ModelSuite;
import io.stagewise.core.pipeline.node.ChecklistValidatorNode;
import io.stagewise.core.pipeline.node.ClarifyObjectiveNode;
import io.stagewise.core.pipeline.node.CodeAgentNode;
import io.stagewise.core.pipeline.node.CriticValidatorNode;
import io.stagewise.core.pipeline.node.ExecuteNode;
import io.stagewise.core.pipeline.node.FinalReportNode;
import io.stagewise.core.pipeline.node.InitHistoryNode;
import io.stagewise.core.pipeline.node.InitSessionNode;
import io.stagewise.core.pipeline.node.MaterializeArtifactsNode;
import io.stagewise.core.pipeline.node.ObjectiveAssessNode;
import io.stagewise.core.pipeline.node.PrepareRunNode;
import io.stagewise.core.pipeline.node.RendezvousNode;
import io.stagewise.core.pipeline.node.StageNodes;
import io.stagewise.core.pipeline.node.StageRouterNode;
import io.stagewise.core.pipeline.node.ValidateFanoutNode;
import io.stagewise.core.pipeline.node.WriteReportNode;
import io.stagewise.core.sandbox.Sandbox;
import io.stagewise.core.template.TemplateResolver;
import java.util.Objects;

/// Assembles the executable pipeline graph from stage definitions.
///
/// The top-level graph runs {@link StageNodes#PREPARE} once and then loops through
/// {@link StageNodes#ROUTE_STAGE}, which dispatches to the sub-graph of the first open stage.
/// Every stage sub-graph is included under the stage's scope and returns to the router when
/// it ends.
///
/// ### Code stage
/// {@snippet :
/// init_session -> init_history -> agent -> execute -> agent
///                                   agent -> validate_fanout => checklist_validator + critic_validator
///                                   (join) -> rendezvous -> agent | materialize_artifacts -> write_report
/// }
///
/// ### Objective stage
/// {@snippet :
/// init_history -> agent -> clarify -> agent
///                 agent -> checklist_validator -> rendezvous -> agent | write_report
/// }
///
/// ### Report stage
/// A single `final_report` node.
public final class StageOrchestrator {

    public static final String GRAPH_NAME = "stagewise-pipeline";

    private final PipelineDefinition definition;
    private final ModelSuite models;
    private final Sandbox sandbox;
    private final SandboxBootstrap bootstrap;
    private final TemplateResolver templates;
    private final RetryPolicy retryPolicy;

    public StageOrchestrator(
            PipelineDefinition definition,
            ModelSuite models,
            Sandbox sandbox,
            SandboxBootstrap bootstrap,
            TemplateResolver templates) {
        this(definition, models, sandbox, bootstrap, templates, RetryPolicy.defaults());
    }

    /// Creates an orchestrator.
    ///
    /// @param definition stage definitions, not null
    /// @param models generators per role, not null
    /// @param sandbox code execution service, not null
    /// @param bootstrap artifact preloading, not null
    /// @param templates prompt template resolver, not null
    /// @param retryPolicy policy for every node except code execution, not null
    public StageOrchestrator(
            PipelineDefinition definition,
            ModelSuite models,
            Sandbox sandbox,
            SandboxBootstrap bootstrap,
            TemplateResolver templates,
            RetryPolicy retryPolicy) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap must not be null");
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    }

    public PipelineDefinition definition() {
        return definition;
    }

    /// Builds the pipeline graph.
    ///
    /// @return the validated graph, never null
    /// @throws io.stagewise.core.graph.GraphDefinitionException if a sub-graph is inconsistent
    public Graph build() {
        Graph.Builder builder = Graph.builder(GRAPH_NAME)
                .node(StageNodes.PREPARE, new PrepareRunNode(), retryPolicy)
                .node(StageNodes.ROUTE_STAGE, new StageRouterNode(definition), retryPolicy)
                .edge(StageNodes.PREPARE, StageNodes.ROUTE_STAGE)
                .entry(StageNodes.PREPARE);
        for (StageDefinition stage : definition.stages()) {
            builder.include(stage.scope(), stageGraph(stage), StageNodes.ROUTE_STAGE);
        }
        return builder.build();
    }

    Graph stageGraph(StageDefinition stage) {
        return switch (stage.kind()) {
            case OBJECTIVE -> objectiveStage(stage);
            case CODE -> codeStage(stage);
            case REPORT -> reportStage(stage);
        };
    }

    private Graph codeStage(StageDefinition stage) {
        return Graph.builder(stage.scope())
                .node(StageNodes.INIT_SESSION, new InitSessionNode(sandbox, bootstrap), retryPolicy)
                .node(StageNodes.INIT_HISTORY, new InitHistoryNode(stage, templates), retryPolicy)
                .node(StageNodes.AGENT, new CodeAgentNode(stage, models.agent(), templates), retryPolicy)
                .node(StageNodes.EXECUTE, new ExecuteNode(sandbox), RetryPolicy.noRetry())
                .node(StageNodes.VALIDATE_FANOUT, new ValidateFanoutNode(models.selector()), retryPolicy)
                .node(StageNodes.CHECKLIST_VALIDATOR,
                        new ChecklistValidatorNode(stage, models.reviewer(), templates), retryPolicy)
                .node(StageNodes.CRITIC_VALIDATOR,
                        new CriticValidatorNode(stage, models.critics(), templates), retryPolicy)
                .node(StageNodes.RENDEZVOUS, new RendezvousNode(stage), retryPolicy)
                .node(StageNodes.MATERIALIZE_ARTIFACTS, new MaterializeArtifactsNode(sandbox), retryPolicy)
                .node(StageNodes.WRITE_REPORT, new WriteReportNode(stage, models.reviewer()), retryPolicy)
                .edge(StageNodes.INIT_SESSION, StageNodes.INIT_HISTORY)
                .edge(StageNodes.INIT_HISTORY, StageNodes.AGENT)
                .edge(StageNodes.EXECUTE, StageNodes.AGENT)
                .edge(StageNodes.CHECKLIST_VALIDATOR, StageNodes.RENDEZVOUS)
                .edge(StageNodes.CRITIC_VALIDATOR, StageNodes.RENDEZVOUS)
                .edge(StageNodes.MATERIALIZE_ARTIFACTS, StageNodes.WRITE_REPORT)
                .join(StageNodes.RENDEZVOUS, StageNodes.CHECKLIST_VALIDATOR, StageNodes.CRITIC_VALIDATOR)
                .entry(StageNodes.INIT_SESSION)
                .build();
    }

    private Graph objectiveStage(StageDefinition stage) {
        return Graph.builder(stage.scope())
                .node(StageNodes.INIT_HISTORY, new InitHistoryNode(stage, templates), retryPolicy)
                .node(StageNodes.AGENT, new ObjectiveAssessNode(stage, models.objective(), templates), retryPolicy)
                .node(StageNodes.CLARIFY, new ClarifyObjectiveNode(models.objective(), templates), retryPolicy)
                .node(StageNodes.CHECKLIST_VALIDATOR,
                        new ChecklistValidatorNode(stage, models.reviewer(), templates), retryPolicy)
                .node(StageNodes.RENDEZVOUS, new RendezvousNode(stage), retryPolicy)
                .node(StageNodes.WRITE_REPORT, new WriteReportNode(stage, models.reviewer()), retryPolicy)
                .edge(StageNodes.INIT_HISTORY, StageNodes.AGENT)
                .edge(StageNodes.CHECKLIST_VALIDATOR, StageNodes.RENDEZVOUS)
                .entry(StageNodes.INIT_HISTORY)
                .build();
    }

    private Graph reportStage(StageDefinition stage) {
        return Graph.builder(stage.scope())
                .node(StageNodes.FINAL_REPORT,
                        new FinalReportNode(stage, models.reviewer(), templates), retryPolicy)
                .entry(StageNodes.FINAL_REPORT)
                .build();
    }
}
