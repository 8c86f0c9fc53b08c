package io.stagewise.core.pipeline.node;

import io.stagewise.core.execution.FatalNodeException;
import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.pipeline.SandboxBootstrap;
import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.Sandbox;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import java.util.List;
import java.util.logging.Logger;

/// Makes sure the run has a live sandbox session.
///
/// A live session from an earlier stage is reused as is, since it still holds every variable.
/// Otherwise a new session is acquired and every artifact is written to a file and bound to
/// its name by the bootstrap script.
public class InitSessionNode implements Node {

    private static final Logger logger = Logger.getLogger(InitSessionNode.class.getName());

    private final Sandbox sandbox;
    private final SandboxBootstrap bootstrap;

    public InitSessionNode(Sandbox sandbox, SandboxBootstrap bootstrap) {
        this.sandbox = sandbox;
        this.bootstrap = bootstrap;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        String existing = state.sessionHandle();
        if (existing != null && sandbox.isAlive(existing)) {
            logger.fine("Reusing sandbox session " + existing);
            return Command.next(StatePatch.EMPTY);
        }

        context.progress("Setting up execution environment...");
        String handle = sandbox.acquireSession();
        List<SandboxBootstrap.PreloadFile> files = bootstrap.files(state.artifacts().values());
        for (SandboxBootstrap.PreloadFile file : files) {
            sandbox.writeFile(handle, file.path(), file.content());
        }
        CodeExecution execution = sandbox.runCode(handle, SandboxBootstrap.script(files));
        if (execution.hasError()) {
            throw new FatalNodeException("Error initializing sandbox: " + execution.error().traceback());
        }
        logger.info("Sandbox session " + handle + " ready with " + files.size() + " preloaded artifacts");
        context.progress("Environment ready!");
        return Command.next(StatePatch.builder().sessionHandle(handle).build());
    }
}
