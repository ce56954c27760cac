package github.sarthakdev143.beat_cutter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SessionStatus(
        String sessionId,
        SessionState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        OutputResolution resolution,
        boolean randomized,
        List<AssetValidationResult> validationResults,
        List<ClipAssignment> assignments,
        List<String> warnings,
        String outputFile) {

    public SessionStatus {
        validationResults = validationResults == null ? List.of() : List.copyOf(validationResults);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonProperty("validCount")
    public long validCount() {
        return validationResults.stream().filter(AssetValidationResult::valid).count();
    }

    public boolean terminal() {
        return state == SessionState.COMPLETED || state == SessionState.FAILED;
    }
}
