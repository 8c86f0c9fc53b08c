package io.stagewise.core.pipeline;

import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.Sandbox;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/// In-memory sandbox recording every call; code results come from registered responses.
public class FakeSandbox implements Sandbox {

    private final AtomicInteger sessions = new AtomicInteger();
    private final Set<String> alive = Collections.synchronizedSet(new HashSet<>());
    private final Map<String, CodeExecution> responses = new HashMap<>();
    private final Map<String, byte[]> files = Collections.synchronizedMap(new HashMap<>());
    private final List<String> executed = Collections.synchronizedList(new ArrayList<>());

    public FakeSandbox respond(String code, CodeExecution execution) {
        responses.put(code, execution);
        return this;
    }

    public void kill(String handle) {
        alive.remove(handle);
    }

    public int acquired() {
        return sessions.get();
    }

    public Map<String, byte[]> files() {
        return files;
    }

    public List<String> executed() {
        return executed;
    }

    @Override
    public String acquireSession() {
        String handle = "sbx-" + sessions.incrementAndGet();
        alive.add(handle);
        return handle;
    }

    @Override
    public boolean isAlive(String handle) {
        return alive.contains(handle);
    }

    @Override
    public void writeFile(String handle, String path, byte[] content) {
        files.put(path, content);
    }

    @Override
    public CodeExecution runCode(String handle, String code) {
        if (!alive.contains(handle)) {
            throw new IllegalStateException("Session " + handle + " is not alive");
        }
        executed.add(code);
        return responses.getOrDefault(code, new CodeExecution("ok", "", List.of(), null));
    }
}
