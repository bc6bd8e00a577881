package com.ghactivity.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Complete activity analysis for one user. Repositories appear in the order they were
 * first seen in the event list.
 */
public record UserActivityReport(
        @JsonProperty("username") String username,
        @JsonProperty("repositories") List<RepositoryActivitySummary> repositories,
        @JsonProperty("total_repositories") int totalRepositories,
        @JsonProperty("total_events") int totalEvents
) {

    public UserActivityReport {
        repositories = List.copyOf(repositories);
    }

    public static UserActivityReport empty(String username) {
        return new UserActivityReport(username, List.of(), 0, 0);
    }
}
