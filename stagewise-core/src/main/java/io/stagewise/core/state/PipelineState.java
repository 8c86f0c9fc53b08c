package io.stagewise.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable, versioned record of all data a pipeline run carries.
///
/// State only changes through {@link #apply(StatePatch)}, which returns a new instance with the
/// version incremented by one. Every channel has a reducer:
///
/// | Channel | Reducer |
/// |---------|---------|
/// | stages | upsert by order, completion is monotonic |
/// | artifacts | upsert by key, last writer wins |
/// | conversation | append with reset sentinel |
/// | everything else | replace |
///
/// ### Contracts
/// - **Stage order**: orders are unique; {@link #stages()} is sorted by order
/// - **Monotonic completion**: a patch that would flip a completed stage back to pending fails
/// - **Single writer**: within one merge, a non-accumulating channel may be written by one patch only
///
/// @param version number of merges applied since creation
/// @param objective the user's objective, never null
/// @param stages stage descriptors sorted by order, never null
/// @param artifacts artifacts by key in insertion order, never null
/// @param sessionHandle sandbox session handle, null before the first session is acquired
/// @param options run flags, never null
/// @param scratch stage-scoped working fields, never null
/// @param finalReport report surfaced when the run completes, null until written
public record PipelineState(
        long version,
        String objective,
        List<Stage> stages,
        Map<String, Artifact> artifacts,
        String sessionHandle,
        RunOptions options,
        StageScratch scratch,
        String finalReport) {

    private static final Reducer<List<Stage>> STAGE_REDUCER = Reducers.upsertBy(Stage::order);
    private static final Reducer<List<Artifact>> ARTIFACT_REDUCER = Reducers.upsertBy(Artifact::key);
    private static final Reducer<List<ChatMessage>> CONVERSATION_REDUCER =
            Reducers.appendWithReset(ChatMessage.RESET);

    public PipelineState {
        Objects.requireNonNull(objective, "objective must not be null");
        Objects.requireNonNull(stages, "stages must not be null");
        Objects.requireNonNull(artifacts, "artifacts must not be null");
        options = options != null ? options : RunOptions.defaults();
        scratch = scratch != null ? scratch : StageScratch.EMPTY;

        List<Stage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(Stage::order));
        Set<Integer> seen = new HashSet<>();
        for (Stage stage : sorted) {
            if (!seen.add(stage.order())) {
                throw new IllegalArgumentException("Duplicate stage order: " + stage.order());
            }
        }
        stages = List.copyOf(sorted);
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    /// Creates the state a run starts from.
    ///
    /// @param objective the user's objective, not null
    /// @param stages pending stage descriptors, not null
    /// @param artifacts input artifacts, not null
    /// @param options run flags, may be null for defaults
    /// @return version 0 state, never null
    public static PipelineState initial(
            String objective, List<Stage> stages, List<Artifact> artifacts, RunOptions options) {
        Map<String, Artifact> byKey = new LinkedHashMap<>();
        ARTIFACT_REDUCER.reduce(List.of(), artifacts).forEach(a -> byKey.put(a.key(), a));
        return new PipelineState(0, objective, stages, byKey, null, options, StageScratch.EMPTY, null);
    }

    /// Returns the first stage by order that is not completed.
    ///
    /// @return the current stage, or empty when every stage is completed
    public Optional<Stage> currentStage() {
        return stages.stream().filter(s -> !s.completed()).findFirst();
    }

    /// Looks up a stage by order.
    ///
    /// @param order stage order
    /// @return the stage, never null
    /// @throws IllegalArgumentException if no stage has that order
    public Stage stage(int order) {
        return stages.stream()
                .filter(s -> s.order() == order)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage with order " + order));
    }

    public boolean allStagesCompleted() {
        return stages.stream().allMatch(Stage::completed);
    }

    public List<ChatMessage> conversation() {
        return scratch.conversation();
    }

    /// Applies a single patch.
    ///
    /// @param patch the patch, not null
    /// @return the merged state with version incremented, never null
    /// @throws IllegalStateException if the patch would revert a completed stage
    public PipelineState apply(StatePatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        return apply(List.of(patch));
    }

    /// Applies the patches of one superstep in the given order as a single merge.
    ///
    /// @param patches patches in declared branch order, not null
    /// @return the merged state with version incremented once, never null
    /// @throws IllegalStateException if two patches write the same non-accumulating channel or
    ///     a completed stage would be reverted
    public PipelineState apply(List<StatePatch> patches) {
        Objects.requireNonNull(patches, "patches must not be null");
        checkSingleWriters(patches);

        Merge merge = new Merge(this);
        for (StatePatch patch : patches) {
            merge.apply(patch);
        }
        return merge.build(version + 1);
    }

    private static void checkSingleWriters(List<StatePatch> patches) {
        if (patches.size() < 2) {
            return;
        }
        Set<Channel> written = EnumSet.noneOf(Channel.class);
        for (StatePatch patch : patches) {
            for (Channel channel : patch.channels()) {
                if (!channel.isAccumulating() && !written.add(channel)) {
                    throw new IllegalStateException(
                            "Channel " + channel + " written by more than one node in one superstep");
                }
            }
        }
    }

    private static final class Merge {

        private final PipelineState base;
        private String objective;
        private List<Stage> stages;
        private List<Artifact> artifacts;
        private String sessionHandle;
        private String finalReport;
        private List<ChatMessage> conversation;
        private String pendingCode;
        private List<ArtifactSelection> selections;
        private ValidationResult checklistResult;
        private List<ValidationResult> criticResults;
        private ObjectiveAssessment assessment;
        private boolean turnLimitReached;

        Merge(PipelineState base) {
            this.base = base;
            this.objective = base.objective;
            this.stages = base.stages;
            this.artifacts = List.copyOf(base.artifacts.values());
            this.sessionHandle = base.sessionHandle;
            this.finalReport = base.finalReport;
            loadScratch(base.scratch);
        }

        private void loadScratch(StageScratch scratch) {
            conversation = scratch.conversation();
            pendingCode = scratch.pendingCode();
            selections = scratch.selections();
            checklistResult = scratch.checklistResult();
            criticResults = scratch.criticResults();
            assessment = scratch.assessment();
            turnLimitReached = scratch.turnLimitReached();
        }

        void apply(StatePatch patch) {
            for (Channel channel : patch.channels()) {
                switch (channel) {
                    case OBJECTIVE -> objective = patch.objective();
                    case STAGES -> stages = mergeStages(stages, patch.stages());
                    case ARTIFACTS -> artifacts = ARTIFACT_REDUCER.reduce(artifacts, patch.artifacts());
                    case SESSION_HANDLE -> sessionHandle = patch.sessionHandle();
                    case SCRATCH_RESET -> loadScratch(StageScratch.EMPTY);
                    case CONVERSATION ->
                            conversation = CONVERSATION_REDUCER.reduce(conversation, patch.conversation());
                    case PENDING_CODE -> pendingCode = patch.pendingCode();
                    case SELECTIONS -> selections = patch.selections();
                    case CHECKLIST_RESULT -> checklistResult = patch.checklistResult();
                    case CRITIC_RESULTS -> criticResults = patch.criticResults();
                    case ASSESSMENT -> assessment = patch.assessment();
                    case TURN_LIMIT -> turnLimitReached = patch.turnLimitReached();
                    case FINAL_REPORT -> finalReport = patch.finalReport();
                }
            }
        }

        private static List<Stage> mergeStages(List<Stage> current, List<Stage> update) {
            Map<Integer, Stage> known = new LinkedHashMap<>();
            current.forEach(s -> known.put(s.order(), s));
            for (Stage incoming : update) {
                Stage existing = known.get(incoming.order());
                if (existing != null && existing.completed() && !incoming.completed()) {
                    throw new IllegalStateException(
                            "Stage " + incoming.order() + " is completed and cannot be reverted");
                }
            }
            return STAGE_REDUCER.reduce(current, update);
        }

        PipelineState build(long version) {
            Map<String, Artifact> byKey = new LinkedHashMap<>();
            artifacts.forEach(a -> byKey.put(a.key(), a));
            StageScratch scratch = new StageScratch(
                    conversation,
                    pendingCode,
                    selections,
                    checklistResult,
                    criticResults,
                    assessment,
                    turnLimitReached);
            return new PipelineState(
                    version, objective, stages, byKey, sessionHandle, base.options, scratch, finalReport);
        }
    }
}
