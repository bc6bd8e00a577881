package com.ghactivity.tracker.client;

import com.ghactivity.tracker.model.Event;

import java.util.List;
import java.util.OptionalInt;

/**
 * Outcome of {@link GitHubEventsClient#fetchEvents(String)}: either the fetched events or
 * exactly one kind of failure. Callers branch on the concrete type.
 */
public sealed interface EventsFetchResult
        permits EventsFetchResult.Fetched,
                EventsFetchResult.UserNotFound,
                EventsFetchResult.RateLimited,
                EventsFetchResult.UpstreamError {

    /**
     * Events returned by GitHub (or served from the cache).
     */
    record Fetched(List<Event> events) implements EventsFetchResult {

        public Fetched {
            events = List.copyOf(events);
        }
    }

    /**
     * GitHub answered 404 for the user.
     */
    record UserNotFound(String username) implements EventsFetchResult {

        public String message() {
            return "User '" + username + "' not found";
        }
    }

    /**
     * GitHub answered 429. {@code retryAfterSeconds} is 0 when no usable
     * {@code Retry-After} header was sent.
     */
    record RateLimited(long retryAfterSeconds) implements EventsFetchResult {

        public boolean hasRetryHint() {
            return retryAfterSeconds > 0;
        }

        public String message() {
            String message = "GitHub API rate limit exceeded";
            if (hasRetryHint()) {
                message += ". Retry after " + retryAfterSeconds + " seconds";
            }
            return message;
        }
    }

    /**
     * Any other non-2xx status, a transport failure, or an unreadable response body.
     * {@code statusCode} is null when no HTTP status was received.
     */
    record UpstreamError(String message, Integer statusCode) implements EventsFetchResult {

        public static UpstreamError withStatus(String message, int statusCode) {
            return new UpstreamError(message, statusCode);
        }

        public static UpstreamError withoutStatus(String message) {
            return new UpstreamError(message, null);
        }

        public OptionalInt status() {
            return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
        }
    }
}
