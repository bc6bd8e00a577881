package com.ghactivity.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Repository reference embedded in a GitHub event.
 *
 * <p>The events API only sends {@code id}, {@code name} and {@code url}; {@code name}
 * already holds the full {@code owner/name} form, so the owner is derived from it.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryRef(
        @JsonProperty(value = "id", required = true) long id,
        @JsonProperty(value = "name", required = true) String name,
        @JsonProperty(value = "url", required = true) String url
) {

    public RepositoryRef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
    }

    public String fullName() {
        return name;
    }

    /**
     * Owner login parsed from {@code owner/name}, or an empty string when the name has
     * no slash.
     */
    public String owner() {
        int slash = name.indexOf('/');
        return slash >= 0 ? name.substring(0, slash) : "";
    }
}
