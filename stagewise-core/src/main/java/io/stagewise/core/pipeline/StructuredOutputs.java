package io.stagewise.core.pipeline;

import static io.stagewise.core.llm.StructuredValues.bool;
import static io.stagewise.core.llm.StructuredValues.objects;
import static io.stagewise.core.llm.StructuredValues.string;

import io.stagewise.core.llm.OutputSchema;
import io.stagewise.core.llm.SchemaField;
import io.stagewise.core.state.ArtifactSelection;
import io.stagewise.core.state.ObjectiveAssessment;
import io.stagewise.core.state.ValidationResult;
import java.util.List;

/// Output schemas of the structured generation calls made by the stage nodes.
public final class StructuredOutputs {

    private StructuredOutputs() {}

    public static final OutputSchema<ValidationResult> VALIDATION = new OutputSchema<>(
            "ValidationResult",
            "Verdict on whether the agent completed its task",
            List.of(
                    SchemaField.string(
                            "chain_of_thought_summary",
                            "A bullet point style summary of your chain of thought reasoning trace."),
                    SchemaField.bool(
                            "pass_the_validation",
                            "True if the agent successfully completed the task. False if it didn't"),
                    SchemaField.optionalString(
                            "message_to_user",
                            "If the validation is not passed, explain to the user why, or ask for"
                                    + " clarification. Otherwise leave this field empty.")),
            raw -> new ValidationResult(
                    string(raw, "chain_of_thought_summary"),
                    bool(raw, "pass_the_validation"),
                    string(raw, "message_to_user")));

    public static final OutputSchema<List<ArtifactSelection>> SELECTIONS = new OutputSchema<>(
            "VariableSelection",
            "Variables to keep for the following stages",
            List.of(SchemaField.objectList(
                    "variable_list",
                    "The selected variables",
                    SchemaField.string("key", "The name of the variable to save"),
                    SchemaField.string(
                            "description",
                            "Explain what this variable is about so that the agent in the next step"
                                    + " can understand it"))),
            raw -> objects(raw, "variable_list").stream()
                    .map(item -> new ArtifactSelection(string(item, "key"), string(item, "description")))
                    .filter(selection -> !selection.key().isBlank())
                    .toList());

    public static final OutputSchema<ObjectiveAssessment> ASSESSMENT = new OutputSchema<>(
            "ObjectiveAssessment",
            "Whether the user request can be worked on as stated",
            List.of(
                    SchemaField.string(
                            "chain_of_thought",
                            "Think aloud about whether the user request is answerable and specific"
                                    + " enough to proceed to the next step."),
                    SchemaField.bool("is_request_answerable", "Whether the data can answer the request"),
                    SchemaField.bool("is_request_specific", "Whether the request is specific enough"),
                    SchemaField.string(
                            "message_to_user",
                            "If either of the above is false, explain why and suggest better"
                                    + " objectives, or ask for the missing details with suggestions."
                                    + " Keep it short.")),
            raw -> new ObjectiveAssessment(
                    string(raw, "chain_of_thought"),
                    bool(raw, "is_request_answerable"),
                    bool(raw, "is_request_specific"),
                    string(raw, "message_to_user")));
}
