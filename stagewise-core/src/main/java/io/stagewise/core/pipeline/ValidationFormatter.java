package io.stagewise.core.pipeline;

import io.stagewise.core.state.ValidationResult;
import java.util.ArrayList;
import java.util.List;

/// Renders validation results for the stage conversation and for the human reviewer.
public final class ValidationFormatter {

    private static final String PASSED = "Validation passed";

    private ValidationFormatter() {}

    public static String checklistMessage(ValidationResult result) {
        return message("Here is the checklist validation result:", result);
    }

    public static String criticMessage(ValidationResult result) {
        return message("Here is the critic validation result:", result);
    }

    private static String message(String heading, ValidationResult result) {
        StringBuilder text = new StringBuilder(heading)
                .append("\n\nReasoning:\n")
                .append(result.reasoningSummary())
                .append("\n\nPass the validation:\n")
                .append(result.passed());
        result.message().ifPresent(m -> text.append("\n\nMessage to user: ").append(m));
        return text.toString().strip();
    }

    /// Builds the question shown to the human at a stage rendezvous.
    ///
    /// @param stageLabel label such as "Stage 2: Data Cleaning", not null
    /// @param checklist checklist verdict, may be null
    /// @param critics critic verdicts in identity order, not null
    /// @return the question, never null
    public static String rendezvousQuestion(
            String stageLabel, ValidationResult checklist, List<ValidationResult> critics) {
        String checklistSummary = checklist == null ? "No checklist validation result" : verdict(checklist);
        String criticSummary;
        if (critics.isEmpty()) {
            criticSummary = "No critic validation results";
        } else {
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < critics.size(); i++) {
                lines.add("Critic " + (i + 1) + ": " + verdict(critics.get(i)));
            }
            criticSummary = String.join("\n", lines);
        }
        return "Finished "
                + stageLabel
                + " just now! Can you check the validation result?\n\n"
                + "Checklist validation result:\n"
                + checklistSummary
                + "\n\nCritic validation result:\n"
                + criticSummary
                + "\n\nNow you can either:\n"
                + "- type \"pass\" or just press enter with no input to RESUME the agent's flow\n"
                + "- type a message that will be INSERTED into the agent's message history\n"
                + "- type \"ignore\" to IGNORE the validation result and go to the next step";
    }

    private static String verdict(ValidationResult result) {
        if (result.passed()) {
            return PASSED;
        }
        return result.message().orElse(result.reasoningSummary());
    }
}
