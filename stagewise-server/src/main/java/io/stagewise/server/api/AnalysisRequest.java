package io.stagewise.server.api;

import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.RunOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/// Property analysis form submitted by the front end.
///
/// The form fields are folded into one objective text; the data file, when given, is loaded
/// from the server's data directory as a table artifact.
///
/// @param question the user's question, not blank
/// @param city target city
/// @param purpose purchase purpose, e.g. investment
/// @param rooms number of rooms
/// @param type property type
/// @param budget budget description
/// @param topN number of results to recommend
/// @param investmentTimeline holding period in years
/// @param method preferred analysis method, may be blank
/// @param additionalInfo free text appended to the objective, may be blank
/// @param skipDefineObjectiveStep skip the objective stage
/// @param useHumanInTheLoop ask the user at every validation rendezvous
/// @param dataFile CSV file relative to the data directory, may be null
/// @param dataKey artifact name for the loaded table, may be null
/// @param dataDescription artifact description for the loaded table, may be null
/// @param artifacts further artifacts sent inline, may be null
public record AnalysisRequest(
        @NotBlank String question,
        String city,
        String purpose,
        @PositiveOrZero Integer rooms,
        String type,
        String budget,
        @PositiveOrZero Integer topN,
        @PositiveOrZero Integer investmentTimeline,
        String method,
        String additionalInfo,
        Boolean skipDefineObjectiveStep,
        Boolean useHumanInTheLoop,
        String dataFile,
        String dataKey,
        String dataDescription,
        List<Artifact> artifacts) {

    /// Builds the objective text from the form fields.
    ///
    /// @return objective, never blank
    public String toObjective() {
        StringBuilder sb = new StringBuilder()
                .append("The user asked the following question:\n")
                .append(question.strip())
                .append("\n\nAnd here are the details:\n")
                .append("- purpose: ").append(text(purpose)).append('\n')
                .append("- city: ").append(text(city)).append('\n')
                .append("- rooms: ").append(text(rooms)).append('\n')
                .append("- type: ").append(text(type)).append('\n')
                .append("- budget: ").append(text(budget)).append('\n')
                .append("- top_n: ").append(text(topN)).append('\n');
        if (investmentTimeline != null) {
            sb.append("- investment_timeline: ").append(investmentTimeline).append(" years\n");
        }
        if (method != null && !method.isBlank()) {
            sb.append("- method: ").append(method.strip()).append('\n');
        }
        if (additionalInfo != null && !additionalInfo.isBlank()) {
            sb.append("- etc: ").append(additionalInfo.strip()).append('\n');
        }
        return sb.toString().strip();
    }

    public RunOptions toOptions() {
        return new RunOptions(Boolean.TRUE.equals(skipDefineObjectiveStep), Boolean.TRUE.equals(useHumanInTheLoop));
    }

    /// Artifact name for the loaded data file: `dataKey`, or the file name stem plus `_df`.
    public String resolvedDataKey() {
        if (dataKey != null && !dataKey.isBlank()) {
            return dataKey.strip();
        }
        String name = dataFile.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String key = stem.replaceAll("[^A-Za-z0-9_]", "_") + "_df";
        return Character.isDigit(key.charAt(0)) ? "data_" + key : key;
    }

    private static String text(Object value) {
        return value != null ? value.toString().strip() : "";
    }
}
