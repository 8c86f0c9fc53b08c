package io.stagewise.core.state;

import java.util.Optional;

/// Pass/fail judgment produced by a checklist or critic validator.
///
/// @param reasoningSummary bullet-style summary of the validator's reasoning, never null
/// @param passed whether the stage work passed validation
/// @param messageToUser explanation for the user when not passed, null otherwise
public record ValidationResult(String reasoningSummary, boolean passed, String messageToUser) {

    public ValidationResult {
        reasoningSummary = reasoningSummary != null ? reasoningSummary : "";
        messageToUser = messageToUser == null || messageToUser.isBlank() ? null : messageToUser;
    }

    public static ValidationResult pass(String reasoningSummary) {
        return new ValidationResult(reasoningSummary, true, null);
    }

    public static ValidationResult fail(String reasoningSummary, String messageToUser) {
        return new ValidationResult(reasoningSummary, false, messageToUser);
    }

    public Optional<String> message() {
        return Optional.ofNullable(messageToUser);
    }
}
