package io.stagewise.core.session;

import static io.stagewise.core.pipeline.ScriptedTextGenerator.assessment;
import static io.stagewise.core.pipeline.ScriptedTextGenerator.selections;
import static io.stagewise.core.pipeline.ScriptedTextGenerator.verdict;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stagewise.core.checkpoint.InMemoryCheckpointer;
import io.stagewise.core.checkpoint.RunStatus;
import io.stagewise.core.execution.GraphExecutor;
import io.stagewise.core.execution.RetryExecutor;
import io.stagewise.core.execution.RunResult;
import io.stagewise.core.graph.Graph;
import io.stagewise.core.llm.ModelSuite;
import io.stagewise.core.pipeline.FakeSandbox;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.pipeline.SandboxBootstrap;
import io.stagewise.core.pipeline.ScriptedTextGenerator;
import io.stagewise.core.pipeline.StageOrchestrator;
import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.ExecutionError;
import io.stagewise.core.sandbox.SandboxOutput;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ArtifactKind;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.RunOptions;
import io.stagewise.core.state.Stage;
import io.stagewise.core.state.Table;
import io.stagewise.core.template.SimpleTemplateResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PipelineRunnerTest {

    private static final String CODE_REPLY = "Let me look at the data.\n```python\nprint(houses.shape)\n```";
    private static final Artifact HOUSES = Artifact.table(
            "houses", "Melbourne house sales", new Table(List.of("suburb", "price"), List.of(List.of("Kew", 10))));

    private ExecutorService pool;
    private ExecutorService sessions;
    private InMemoryCheckpointer checkpointer;
    private FakeSandbox sandbox;
    private ScriptedTextGenerator objective;
    private ScriptedTextGenerator reviewer;
    private PipelineRunner runner;
    private List<PipelineEvent> events;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        sessions = Executors.newSingleThreadExecutor();
        checkpointer = new InMemoryCheckpointer();
        sandbox = new FakeSandbox();
        Table cleaned = new Table(List.of("suburb"), List.of(List.of("Kew")));
        sandbox.respond("df_clean", new CodeExecution("", "", List.of(new SandboxOutput(ArtifactKind.TABLE, cleaned)), null));

        ScriptedTextGenerator agent = new ScriptedTextGenerator("agent").otherwiseText(conversation -> {
            String last = conversation.get(conversation.size() - 1).content();
            return last.startsWith("<stdout>") ? "DONE" : CODE_REPLY;
        });
        objective = new ScriptedTextGenerator("objective");
        ScriptedTextGenerator selector = new ScriptedTextGenerator("selector")
                .otherwiseObject(selections(Map.of("df_clean", "cleaned house sales")));
        reviewer = new ScriptedTextGenerator("reviewer")
                .otherwiseObject(verdict(true, null))
                .otherwiseText(conversation -> conversation.get(0).content().contains("# Original objective")
                        ? "# Final report"
                        : "Stage work went as planned.");
        ScriptedTextGenerator critic = new ScriptedTextGenerator("critic").otherwiseObject(verdict(true, null));
        ModelSuite models = new ModelSuite(agent, objective, selector, reviewer, List.of(critic, critic));

        PipelineDefinition definition = PipelineDefinition.defaults();
        Graph graph = new StageOrchestrator(
                definition, models, sandbox, new SandboxBootstrap(null), new SimpleTemplateResolver()).build();
        GraphExecutor executor = new GraphExecutor(pool, checkpointer, new RetryExecutor(delay -> {}));
        runner = new PipelineRunner(executor, graph, definition, checkpointer, new SessionRegistry(), sessions);
        events = Collections.synchronizedList(new ArrayList<>());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        sessions.shutdownNow();
    }

    private PipelineRequest request(boolean skipFirstStage, boolean useHumanInTheLoop) {
        return new PipelineRequest(
                "Which suburb has the best price growth?",
                List.of(HOUSES),
                new RunOptions(skipFirstStage, useHumanInTheLoop));
    }

    private List<Integer> startedStages() {
        synchronized (events) {
            return events.stream()
                    .filter(PipelineEvent.StageStarted.class::isInstance)
                    .map(e -> ((PipelineEvent.StageStarted) e).stage())
                    .toList();
        }
    }

    private PipelineEvent lastEvent() {
        synchronized (events) {
            return events.get(events.size() - 1);
        }
    }

    @Nested
    class Automatic {

        @Test
        void shouldRunEveryStageToFinalReport() {
            RunResult result = runner.run("s-1", request(true, false), events::add);

            assertThat(result).isInstanceOf(RunResult.Completed.class);
            PipelineState state = result.state();
            assertThat(state.finalReport()).isEqualTo("# Final report");
            assertThat(state.stages()).allMatch(Stage::completed);
            assertThat(state.stage(1).report()).isEmpty();
            assertThat(state.stage(2).report()).isEqualTo("Stage work went as planned.");
            assertThat(state.artifacts()).containsOnlyKeys("houses", "df_clean");
            assertThat(startedStages()).containsExactly(2, 3, 4, 5);
            assertThat(lastEvent()).isEqualTo(new PipelineEvent.Completed("s-1", "# Final report"));
        }

        @Test
        void shouldKeepOneSandboxSessionAcrossStages() {
            runner.run("s-1", request(true, false), events::add);

            assertThat(sandbox.acquired()).isEqualTo(1);
            assertThat(sandbox.files()).containsOnlyKeys("/tmp/houses.csv");
        }

        @Test
        void shouldRecordCompletedStatus() {
            runner.run("s-1", request(true, false), events::add);

            SessionInfo info = runner.status("s-1").orElseThrow();
            assertThat(info.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(info.currentStage()).isZero();
            assertThat(info.finalReport()).isEqualTo("# Final report");
            assertThat(runner.isRunning("s-1")).isFalse();
        }

        @Test
        void shouldRunAsynchronously() throws Exception {
            RunResult result = runner.start("s-1", request(true, false), events::add).get(30, TimeUnit.SECONDS);

            assertThat(result).isInstanceOf(RunResult.Completed.class);
        }

        @Test
        void shouldRejectSecondStartOfSameSession() {
            runner.run("s-1", request(true, false), events::add);

            assertThatThrownBy(() -> runner.run("s-1", request(true, false), events::add))
                    .isInstanceOf(SessionStateException.class);
        }

        @Test
        void shouldReportFatalSandboxFailure() {
            SandboxBootstrap bootstrap = new SandboxBootstrap(null);
            sandbox.respond(
                    SandboxBootstrap.script(bootstrap.files(List.of(HOUSES))),
                    CodeExecution.failed(new ExecutionError("ModuleNotFoundError", "pandas", "no pandas here")));

            RunResult result = runner.run("s-1", request(true, false), events::add);

            assertThat(result).isInstanceOf(RunResult.Failed.class);
            assertThat(((RunResult.Failed) result).error()).contains("Error initializing sandbox: no pandas here");
            assertThat(lastEvent()).isInstanceOf(PipelineEvent.Failed.class);
            assertThat(runner.status("s-1").orElseThrow().status()).isEqualTo(RunStatus.ERROR);
        }
    }

    @Nested
    class HumanInTheLoop {

        @Test
        void shouldPauseAtEachRendezvousUntilAnswered() {
            RunResult first = runner.run("s-1", request(true, true), events::add);

            assertThat(first).isInstanceOf(RunResult.Suspended.class);
            String question = ((RunResult.Suspended) first).interrupt().message();
            assertThat(question).startsWith("Finished Stage 2: Data Cleaning just now!");
            assertThat(lastEvent()).isEqualTo(new PipelineEvent.InputRequired("s-1", question));
            assertThat(runner.status("s-1").orElseThrow().pendingMessage()).isEqualTo(question);

            RunResult second = runner.resume("s-1", "pass", events::add);

            assertThat(second).isInstanceOf(RunResult.Suspended.class);
            assertThat(second.state().stage(2).completed()).isTrue();
            assertThat(((RunResult.Suspended) second).interrupt().message()).contains("Stage 3: Data Exploration");
        }

        @Test
        void shouldInsertFreeTextIntoAgentConversation() {
            runner.run("s-1", request(true, true), events::add);

            RunResult result = runner.resume("s-1", "Also drop rows without a price", events::add);

            assertThat(result).isInstanceOf(RunResult.Suspended.class);
            assertThat(result.state().stage(2).completed()).isFalse();
            assertThat(result.state().conversation())
                    .contains(ChatMessage.user("Also drop rows without a price"));
        }

        @Test
        void shouldCancelOnQuitWord() {
            runner.run("s-1", request(true, true), events::add);

            RunResult result = runner.resume("s-1", " Quit ", events::add);

            assertThat(result).isInstanceOf(RunResult.Cancelled.class);
            assertThat(lastEvent()).isEqualTo(new PipelineEvent.Cancelled("s-1"));
            assertThat(runner.status("s-1").orElseThrow().status()).isEqualTo(RunStatus.CANCELLED);
            assertThatThrownBy(() -> runner.resume("s-1", "pass", events::add))
                    .isInstanceOf(SessionStateException.class);
        }

        @Test
        void shouldCancelSessionAtRest() {
            runner.run("s-1", request(true, true), events::add);

            assertThat(runner.cancel("s-1", events::add)).isTrue();
            assertThat(runner.cancel("s-1", events::add)).isFalse();
            assertThat(runner.status("s-1").orElseThrow().status()).isEqualTo(RunStatus.CANCELLED);
        }

        @Test
        void shouldRejectResumeOfUnknownSession() {
            assertThatThrownBy(() -> runner.resume("missing", "pass", events::add))
                    .isInstanceOf(SessionNotFoundException.class)
                    .hasMessage("Session not found: missing");
        }
    }

    @Nested
    class ObjectiveStage {

        @Test
        void shouldClarifyObjectiveWithUserBeforeDataWork() {
            objective.object(assessment(true, false, "Which years should be compared?"))
                    .text("Compare suburb price growth between 2015 and 2020.")
                    .object(assessment(true, true, ""));

            RunResult first = runner.run("s-1", request(false, false), events::add);

            assertThat(first).isInstanceOf(RunResult.Suspended.class);
            assertThat(((RunResult.Suspended) first).interrupt().message()).isEqualTo("Which years should be compared?");
            assertThat(sandbox.acquired()).isZero();

            RunResult done = runner.resume("s-1", "2015 to 2020", events::add);

            assertThat(done).isInstanceOf(RunResult.Completed.class);
            assertThat(done.state().objective()).isEqualTo("Compare suburb price growth between 2015 and 2020.");
            assertThat(done.state().stage(1).report()).isEqualTo("Stage work went as planned.");
            assertThat(startedStages()).containsExactly(1, 2, 3, 4, 5);
        }

        @Test
        void shouldStopRunWhenObjectiveNeverSettles() {
            objective.otherwiseObject(assessment(false, false, "This data has no prices."))
                    .otherwiseText(conversation -> "Still unclear objective");

            RunResult result = runner.run("s-1", request(false, false), events::add);
            for (int round = 0; round < 5 && result instanceof RunResult.Suspended; round++) {
                result = runner.resume("s-1", "not sure", events::add);
            }

            assertThat(result).isInstanceOf(RunResult.Completed.class);
            assertThat(result.state().finalReport()).contains("Last objective: Still unclear objective");
            assertThat(result.state().stage(2).completed()).isFalse();
            assertThat(sandbox.acquired()).isZero();
        }
    }
}
