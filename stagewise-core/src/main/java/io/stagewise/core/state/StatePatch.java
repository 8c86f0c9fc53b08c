package io.stagewise.core.state;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Declarative, immutable description of a state change produced by a node.
///
/// A patch names the channels it writes and holds a typed value for each; {@link PipelineState#apply}
/// merges it using the channel's reducer. A channel's accessor is only meaningful when
/// {@link #writes(Channel)} is true. Nodes never mutate state directly.
///
/// {@snippet :
/// StatePatch patch = StatePatch.builder()
///         .append(ChatMessage.assistant(response))
///         .pendingCode(code)
///         .build();
/// }
///
/// @see PipelineState#apply(StatePatch)
/// @see Channel
public final class StatePatch {

    public static final StatePatch EMPTY = new Builder().snapshot();

    private final Set<Channel> written;
    private final String objective;
    private final List<Stage> stages;
    private final List<Artifact> artifacts;
    private final String sessionHandle;
    private final List<ChatMessage> conversation;
    private final String pendingCode;
    private final List<ArtifactSelection> selections;
    private final ValidationResult checklistResult;
    private final List<ValidationResult> criticResults;
    private final ObjectiveAssessment assessment;
    private final boolean turnLimitReached;
    private final String finalReport;

    private StatePatch(Builder builder) {
        this.written = Collections.unmodifiableSet(EnumSet.copyOf(builder.written));
        this.objective = builder.objective;
        this.stages = List.copyOf(builder.stages);
        this.artifacts = List.copyOf(builder.artifacts);
        this.sessionHandle = builder.sessionHandle;
        this.conversation = List.copyOf(builder.messages);
        this.pendingCode = builder.pendingCode;
        this.selections = builder.selections;
        this.checklistResult = builder.checklistResult;
        this.criticResults = builder.criticResults;
        this.assessment = builder.assessment;
        this.turnLimitReached = builder.turnLimitReached;
        this.finalReport = builder.finalReport;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the channels written by this patch, in merge order.
    ///
    /// @return written channels, never null
    public Set<Channel> channels() {
        return written;
    }

    public boolean writes(Channel channel) {
        return written.contains(channel);
    }

    public boolean isEmpty() {
        return written.isEmpty();
    }

    public String objective() {
        return objective;
    }

    /// Stage descriptors to upsert by order.
    public List<Stage> stages() {
        return stages;
    }

    /// Artifacts to upsert by key, in write order.
    public List<Artifact> artifacts() {
        return artifacts;
    }

    public String sessionHandle() {
        return sessionHandle;
    }

    /// Messages to append, possibly containing {@link ChatMessage#RESET}.
    public List<ChatMessage> conversation() {
        return conversation;
    }

    public String pendingCode() {
        return pendingCode;
    }

    public List<ArtifactSelection> selections() {
        return selections;
    }

    public ValidationResult checklistResult() {
        return checklistResult;
    }

    public List<ValidationResult> criticResults() {
        return criticResults;
    }

    public ObjectiveAssessment assessment() {
        return assessment;
    }

    public boolean turnLimitReached() {
        return turnLimitReached;
    }

    public String finalReport() {
        return finalReport;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatePatch other)) {
            return false;
        }
        return written.equals(other.written)
                && Objects.equals(objective, other.objective)
                && stages.equals(other.stages)
                && artifacts.equals(other.artifacts)
                && Objects.equals(sessionHandle, other.sessionHandle)
                && conversation.equals(other.conversation)
                && Objects.equals(pendingCode, other.pendingCode)
                && Objects.equals(selections, other.selections)
                && Objects.equals(checklistResult, other.checklistResult)
                && Objects.equals(criticResults, other.criticResults)
                && Objects.equals(assessment, other.assessment)
                && turnLimitReached == other.turnLimitReached
                && Objects.equals(finalReport, other.finalReport);
    }

    @Override
    public int hashCode() {
        return written.hashCode();
    }

    @Override
    public String toString() {
        return "StatePatch" + written;
    }

    public static final class Builder {

        private final Set<Channel> written = EnumSet.noneOf(Channel.class);
        private final List<ChatMessage> messages = new ArrayList<>();
        private final List<Stage> stages = new ArrayList<>();
        private final List<Artifact> artifacts = new ArrayList<>();
        private String objective;
        private String sessionHandle;
        private String pendingCode;
        private List<ArtifactSelection> selections;
        private ValidationResult checklistResult;
        private List<ValidationResult> criticResults;
        private ObjectiveAssessment assessment;
        private boolean turnLimitReached;
        private String finalReport;

        private Builder() {}

        public Builder objective(String objective) {
            this.objective = Objects.requireNonNull(objective, "objective must not be null");
            written.add(Channel.OBJECTIVE);
            return this;
        }

        /// Upserts a stage descriptor, keyed by order.
        public Builder stage(Stage stage) {
            stages.add(Objects.requireNonNull(stage, "stage must not be null"));
            written.add(Channel.STAGES);
            return this;
        }

        /// Upserts an artifact, keyed by name; a later write of the same key wins.
        public Builder artifact(Artifact artifact) {
            artifacts.add(Objects.requireNonNull(artifact, "artifact must not be null"));
            written.add(Channel.ARTIFACTS);
            return this;
        }

        public Builder artifacts(List<Artifact> artifacts) {
            artifacts.forEach(this::artifact);
            return this;
        }

        public Builder sessionHandle(String sessionHandle) {
            this.sessionHandle = sessionHandle;
            written.add(Channel.SESSION_HANDLE);
            return this;
        }

        public Builder append(ChatMessage... messages) {
            if (messages.length > 0) {
                this.messages.addAll(Arrays.asList(messages));
                written.add(Channel.CONVERSATION);
            }
            return this;
        }

        /// Clears the conversation; messages appended afterwards start the new conversation.
        public Builder resetConversation() {
            return append(ChatMessage.RESET);
        }

        public Builder pendingCode(String code) {
            this.pendingCode = code;
            written.add(Channel.PENDING_CODE);
            return this;
        }

        public Builder selections(List<ArtifactSelection> selections) {
            this.selections = List.copyOf(selections);
            written.add(Channel.SELECTIONS);
            return this;
        }

        public Builder checklistResult(ValidationResult result) {
            this.checklistResult = result;
            written.add(Channel.CHECKLIST_RESULT);
            return this;
        }

        public Builder criticResults(List<ValidationResult> results) {
            this.criticResults = List.copyOf(results);
            written.add(Channel.CRITIC_RESULTS);
            return this;
        }

        public Builder assessment(ObjectiveAssessment assessment) {
            this.assessment = assessment;
            written.add(Channel.ASSESSMENT);
            return this;
        }

        public Builder turnLimitReached(boolean reached) {
            this.turnLimitReached = reached;
            written.add(Channel.TURN_LIMIT);
            return this;
        }

        /// Discards all stage-scoped fields before any other scratch write in this patch.
        public Builder clearScratch() {
            written.add(Channel.SCRATCH_RESET);
            return this;
        }

        public Builder finalReport(String report) {
            this.finalReport = report;
            written.add(Channel.FINAL_REPORT);
            return this;
        }

        public StatePatch build() {
            return written.isEmpty() ? EMPTY : snapshot();
        }

        private StatePatch snapshot() {
            return new StatePatch(this);
        }
    }
}
