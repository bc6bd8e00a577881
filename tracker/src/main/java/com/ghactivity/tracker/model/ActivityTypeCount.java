package com.ghactivity.tracker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of occurrences of one activity type within a repository.
 */
public record ActivityTypeCount(
        @JsonProperty("type") String type,
        @JsonProperty("count") int count
) {}
