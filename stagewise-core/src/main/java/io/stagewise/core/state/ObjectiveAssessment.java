package io.stagewise.core.state;

/// Structured verdict on whether the user's objective can be worked on as stated.
///
/// @param reasoning the assessor's reasoning, never null
/// @param answerable whether the objective can be answered with the supplied data
/// @param specific whether the objective is specific enough to proceed
/// @param messageToUser question or explanation for the user, never null
public record ObjectiveAssessment(
        String reasoning, boolean answerable, boolean specific, String messageToUser) {

    public ObjectiveAssessment {
        reasoning = reasoning != null ? reasoning : "";
        messageToUser = messageToUser != null ? messageToUser : "";
    }

    /// Returns whether the objective needs no further clarification.
    ///
    /// @return true if answerable and specific
    public boolean ready() {
        return answerable && specific;
    }
}
