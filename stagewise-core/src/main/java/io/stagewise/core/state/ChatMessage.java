package io.stagewise.core.state;

import java.util.Objects;

/// One turn of a stage conversation.
///
/// @param role who produced the turn, not null
/// @param content the turn text, never null
public record ChatMessage(Role role, String content) {

    /// Sentinel that clears the conversation when it appears in an append patch.
    public static final ChatMessage RESET = new ChatMessage(Role.SYSTEM, "RESET_LIST");

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content != null ? content : "";
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(Role.ASSISTANT, content);
    }

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT
    }
}
