package com.ghactivity.tracker.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON error body: {@code {"detail": "..."}}.
 */
public record ErrorResponse(@JsonProperty("detail") String detail) {}
