package io.stagewise.core.sandbox;

/// Stateful code-execution service.
///
/// A session keeps variables alive between `runCode` calls; its handle is stored in the
/// pipeline state and reused across stages while the sandbox reports it alive.
public interface Sandbox {

    /// Starts a new session.
    ///
    /// @return opaque session handle, not null
    /// @throws SandboxException if the session cannot be created
    String acquireSession();

    /// Reports whether a session can still run code.
    ///
    /// @param handle session handle, not null
    /// @return true if the session is usable
    boolean isAlive(String handle);

    /// Writes a file into the session's filesystem.
    ///
    /// @param handle session handle, not null
    /// @param path absolute path inside the session, not null
    /// @param content file bytes, not null
    /// @throws SandboxException if the write fails
    void writeFile(String handle, String path, byte[] content);

    /// Runs code in the session.
    ///
    /// Runtime errors in the code are reported through {@link CodeExecution#error()}, not thrown.
    ///
    /// @param handle session handle, not null
    /// @param code source to run, not null
    /// @return captured output, never null
    /// @throws SandboxException if the sandbox itself fails
    CodeExecution runCode(String handle, String code);
}
