package com.ghactivity.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Data transfer object representing a public GitHub event.
 * Maps from: /users/{username}/events
 *
 * <p>{@code type} is kept as the raw upstream string (e.g. {@code PushEvent}); GitHub
 * owns that vocabulary. {@code created_at} accepts any ISO-8601 offset, including the
 * {@code Z} suffix GitHub sends.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Event(
        @JsonProperty(value = "id", required = true) long id,
        @JsonProperty(value = "type", required = true) String type,
        @JsonProperty(value = "actor", required = true) Actor actor,
        @JsonProperty(value = "repo", required = true) RepositoryRef repo,
        @JsonProperty(value = "created_at", required = true) OffsetDateTime createdAt
) {

    public Event {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(repo, "repo");
        Objects.requireNonNull(createdAt, "created_at");
    }

    public String activityType() {
        return type;
    }

    public String actorLogin() {
        return actor.login();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Actor(
            @JsonProperty(value = "login", required = true) String login,
            @JsonProperty("id") long id
    ) {

        public Actor {
            Objects.requireNonNull(login, "login");
        }
    }
}
