package io.stagewise.core.pipeline.node;

/// Local node ids used inside stage sub-graphs and the top-level pipeline graph.
public final class StageNodes {

    private StageNodes() {}

    public static final String PREPARE = "prepare";
    public static final String ROUTE_STAGE = "route_stage";

    public static final String INIT_SESSION = "init_session";
    public static final String INIT_HISTORY = "init_history";
    public static final String AGENT = "agent";
    public static final String EXECUTE = "execute";
    public static final String VALIDATE_FANOUT = "validate_fanout";
    public static final String CLARIFY = "clarify";
    public static final String CHECKLIST_VALIDATOR = "checklist_validator";
    public static final String CRITIC_VALIDATOR = "critic_validator";
    public static final String RENDEZVOUS = "rendezvous";
    public static final String MATERIALIZE_ARTIFACTS = "materialize_artifacts";
    public static final String WRITE_REPORT = "write_report";
    public static final String FINAL_REPORT = "final_report";
}
