package com.ghactivity.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Activity summary for a single repository: its most frequent event types (at most
 * three, most frequent first) and whether the analyzed user owns it.
 */
public record RepositoryActivitySummary(
        @JsonProperty("repository_name") String repositoryName,
        @JsonProperty("is_owner") boolean ownedByUser,
        @JsonProperty("top_activity_types") List<ActivityTypeCount> topActivityTypes
) {

    public RepositoryActivitySummary {
        topActivityTypes = List.copyOf(topActivityTypes);
    }
}
