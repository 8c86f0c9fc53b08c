package io.stagewise.server.api;

import io.stagewise.core.checkpoint.Checkpoint;
import io.stagewise.core.session.PipelineRequest;
import io.stagewise.core.session.SessionInfo;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.RunOptions;
import io.stagewise.core.state.Stage;
import io.stagewise.server.data.CsvTableLoader;
import io.stagewise.server.service.SessionService;
import io.stagewise.server.validation.LogSanitizer;
import io.stagewise.server.validation.ValidSessionId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for analysis sessions.
///
/// Runs are asynchronous: start, input and recover return `202 Accepted` and the outcome
/// arrives on the session's SSE stream ({@link SessionEventResource}).
///
/// | Method | Path | Purpose |
/// |--------|------|---------|
/// | `POST` | `/api/v1/sessions` | start from an objective and inline artifacts |
/// | `POST` | `/api/v1/sessions/analysis` | start from the analysis form |
/// | `POST` | `/api/v1/sessions/{id}/input` | answer a waiting session |
/// | `POST` | `/api/v1/sessions/{id}/recover` | continue after a crash or error |
/// | `POST` | `/api/v1/sessions/{id}/cancel` | cancel |
/// | `GET` | `/api/v1/sessions/{id}` | status |
/// | `GET` | `/api/v1/sessions/{id}/history` | checkpoint history |
///
/// @see SessionService for the session operations
@Path("/api/v1/sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PipelineResource {

    private static final Logger LOG = Logger.getLogger(PipelineResource.class);

    private final SessionService sessionService;
    private final CsvTableLoader tableLoader;

    @Inject
    public PipelineResource(SessionService sessionService, CsvTableLoader tableLoader) {
        this.sessionService = sessionService;
        this.tableLoader = tableLoader;
    }

    /// Starts a session.
    ///
    /// ### Request
    /// ```json
    /// {"objective": "Find the best suburbs ...",
    ///  "artifacts": [{"key": "sales_df", "kind": "dataframe", "description": "...",
    ///                 "value": {"type": "table", "columns": [...], "rows": [...]}}],
    ///  "skipFirstStage": false, "useHumanInTheLoop": true}
    /// ```
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"sessionId": "s-6f1c..."}
    /// ```
    @POST
    public Response start(@Valid @NotNull StartSessionRequest request) {
        LOG.infov("Start session request with {0} artifacts",
                request.artifacts() != null ? request.artifacts().size() : 0);
        String sessionId = sessionService.startSession(new PipelineRequest(
                request.objective(),
                request.artifacts(),
                new RunOptions(
                        Boolean.TRUE.equals(request.skipFirstStage()),
                        Boolean.TRUE.equals(request.useHumanInTheLoop()))));
        return Response.accepted().entity(Map.of("sessionId", sessionId)).build();
    }

    /// Starts a session from the analysis form.
    ///
    /// The form is turned into an objective; `dataFile` is loaded from the data directory as a
    /// table artifact.
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"sessionId": "s-6f1c...", "objective": "The user asked ..."}
    /// ```
    @POST
    @Path("/analysis")
    public Response startAnalysis(@Valid @NotNull AnalysisRequest request) {
        List<Artifact> artifacts = new ArrayList<>();
        if (request.dataFile() != null && !request.dataFile().isBlank()) {
            String description = request.dataDescription() != null
                    ? request.dataDescription()
                    : "This dataframe contains the data loaded from " + request.dataFile() + ".";
            artifacts.add(Artifact.table(
                    request.resolvedDataKey(), description, tableLoader.load(request.dataFile())));
        }
        if (request.artifacts() != null) {
            artifacts.addAll(request.artifacts());
        }
        String objective = request.toObjective();
        LOG.infov("Start analysis request: {0} artifacts, humanInTheLoop={1}",
                artifacts.size(), request.toOptions().useHumanInTheLoop());
        String sessionId =
                sessionService.startSession(new PipelineRequest(objective, artifacts, request.toOptions()));
        return Response.accepted()
                .entity(Map.of("sessionId", sessionId, "objective", objective))
                .build();
    }

    /// Answers a session waiting for input. `q` or `quit` cancels it.
    ///
    /// ### Request
    /// ```json
    /// {"input": "pass"}
    /// ```
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"status": "resumed"}
    /// ```
    @POST
    @Path("/{sessionId}/input")
    public Response input(
            @PathParam("sessionId") @ValidSessionId String sessionId, @Valid @NotNull InputRequest request) {
        LOG.infov("Input for session {0}", LogSanitizer.sanitize(sessionId));
        boolean quit = sessionService.respond(sessionId, request.input());
        return Response.accepted()
                .entity(Map.of("status", quit ? "cancelled" : "resumed"))
                .build();
    }

    @POST
    @Path("/{sessionId}/recover")
    public Response recover(@PathParam("sessionId") @ValidSessionId String sessionId) {
        LOG.infov("Recover request for session {0}", LogSanitizer.sanitize(sessionId));
        sessionService.recover(sessionId);
        return Response.accepted().entity(Map.of("status", "recovering")).build();
    }

    /// Cancels a session.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"cancelled": true}
    /// ```
    /// `false` means the session had already finished.
    @POST
    @Path("/{sessionId}/cancel")
    public Response cancel(@PathParam("sessionId") @ValidSessionId String sessionId) {
        LOG.infov("Cancel request for session {0}", LogSanitizer.sanitize(sessionId));
        boolean cancelled = sessionService.cancel(sessionId);
        return Response.ok().entity(Map.of("cancelled", cancelled)).build();
    }

    /// Gets the status of a session.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"sessionId": "s-1", "status": "WAITING_FOR_INPUT", "currentStage": 2,
    ///  "pendingMessage": "...", "finalReport": null, "error": null,
    ///  "checkpointSequence": 14, "updatedAt": "...", "running": false}
    /// ```
    @GET
    @Path("/{sessionId}")
    public SessionStatusResponse status(@PathParam("sessionId") @ValidSessionId String sessionId) {
        SessionInfo info = sessionService.status(sessionId);
        return SessionStatusResponse.from(info, sessionService.isRunning(sessionId));
    }

    /// Lists the checkpoints of a session, oldest first, without their state payloads.
    @GET
    @Path("/{sessionId}/history")
    public List<CheckpointSummary> history(@PathParam("sessionId") @ValidSessionId String sessionId) {
        return sessionService.history(sessionId).stream().map(CheckpointSummary::from).toList();
    }

    /// Request body for {@link #start}.
    public record StartSessionRequest(
            @NotBlank String objective,
            List<Artifact> artifacts,
            Boolean skipFirstStage,
            Boolean useHumanInTheLoop) {}

    /// Request body for {@link #input}.
    public record InputRequest(@NotNull String input) {}

    /// Response body of {@link #status}.
    public record SessionStatusResponse(
            String sessionId,
            String status,
            int currentStage,
            String pendingMessage,
            String finalReport,
            String error,
            long checkpointSequence,
            Instant updatedAt,
            boolean running) {

        static SessionStatusResponse from(SessionInfo info, boolean running) {
            return new SessionStatusResponse(
                    info.sessionId(),
                    info.status().name(),
                    info.currentStage(),
                    info.pendingMessage(),
                    info.finalReport(),
                    info.error(),
                    info.checkpointSequence(),
                    info.updatedAt(),
                    running);
        }
    }

    /// One entry of {@link #history}.
    public record CheckpointSummary(
            long sequence,
            String status,
            List<String> nextNodes,
            int completedStages,
            String pendingMessage,
            String error,
            Instant createdAt) {

        static CheckpointSummary from(Checkpoint checkpoint) {
            return new CheckpointSummary(
                    checkpoint.sequence(),
                    checkpoint.status().name(),
                    checkpoint.nextNodes(),
                    (int) checkpoint.state().stages().stream().filter(Stage::completed).count(),
                    checkpoint.pendingInterrupt() != null ? checkpoint.pendingInterrupt().message() : null,
                    checkpoint.error(),
                    checkpoint.createdAt());
        }
    }
}
