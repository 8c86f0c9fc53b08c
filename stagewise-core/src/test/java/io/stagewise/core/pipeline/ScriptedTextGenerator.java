package io.stagewise.core.pipeline;

import io.stagewise.core.llm.OutputSchema;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.state.ChatMessage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/// Text generator answering from scripted replies.
///
/// Free-text calls take the next text reply; structured calls take the next raw object and
/// bind it through the requested schema. A fallback reply, when set, answers once a queue
/// runs dry.
public class ScriptedTextGenerator implements TextGenerator {

    private final String id;
    private final Deque<String> texts = new ArrayDeque<>();
    private final Deque<Map<String, Object>> objects = new ArrayDeque<>();
    private final List<List<ChatMessage>> calls = new ArrayList<>();
    private Function<List<ChatMessage>, String> fallbackText;
    private Map<String, Object> fallbackObject;

    public ScriptedTextGenerator(String id) {
        this.id = id;
    }

    public ScriptedTextGenerator text(String... replies) {
        texts.addAll(List.of(replies));
        return this;
    }

    public ScriptedTextGenerator object(Map<String, Object> raw) {
        objects.add(raw);
        return this;
    }

    public ScriptedTextGenerator otherwiseText(Function<List<ChatMessage>, String> reply) {
        this.fallbackText = reply;
        return this;
    }

    public ScriptedTextGenerator otherwiseObject(Map<String, Object> raw) {
        this.fallbackObject = raw;
        return this;
    }

    public List<List<ChatMessage>> calls() {
        return calls;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized String generate(List<ChatMessage> conversation) {
        calls.add(List.copyOf(conversation));
        if (!texts.isEmpty()) {
            return texts.poll();
        }
        if (fallbackText != null) {
            return fallbackText.apply(conversation);
        }
        throw new IllegalStateException(id + " has no scripted text reply left");
    }

    @Override
    public synchronized <T> T generate(List<ChatMessage> conversation, OutputSchema<T> schema) {
        calls.add(List.copyOf(conversation));
        Map<String, Object> raw = !objects.isEmpty() ? objects.poll() : fallbackObject;
        if (raw == null) {
            throw new IllegalStateException(id + " has no scripted " + schema.name() + " left");
        }
        return schema.bind(raw);
    }

    public static Map<String, Object> verdict(boolean passed, String message) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("chain_of_thought_summary", "- looked at the work");
        raw.put("pass_the_validation", passed);
        raw.put("message_to_user", message);
        return raw;
    }

    public static Map<String, Object> assessment(boolean answerable, boolean specific, String message) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("chain_of_thought", "thinking about the request");
        raw.put("is_request_answerable", answerable);
        raw.put("is_request_specific", specific);
        raw.put("message_to_user", message);
        return raw;
    }

    public static Map<String, Object> selections(Map<String, String> descriptionsByKey) {
        List<Map<String, Object>> items = new ArrayList<>();
        descriptionsByKey.forEach((key, description) -> items.add(Map.of("key", key, "description", description)));
        return Map.of("variable_list", items);
    }
}
