package com.privacygraph.common.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of materializing a single extracted node or edge.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionOutcome(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("label") String label,
    @JsonProperty("status") Status status,
    @JsonProperty("createdId") String createdId,
    @JsonProperty("reason") String reason
) {
    public enum Kind {
        NODE,
        EDGE
    }

    public enum Status {
        CREATED,
        SKIPPED_UNKNOWN_TYPE,
        SKIPPED_UNRESOLVED_ENDPOINT,
        FAILED
    }

    public static IngestionOutcome created(Kind kind, String label, String createdId) {
        return new IngestionOutcome(kind, label, Status.CREATED, createdId, null);
    }

    public static IngestionOutcome skipped(Kind kind, String label, Status status, String reason) {
        return new IngestionOutcome(kind, label, status, null, reason);
    }

    @JsonIgnore
    public boolean isCreated() {
        return status == Status.CREATED;
    }
}
