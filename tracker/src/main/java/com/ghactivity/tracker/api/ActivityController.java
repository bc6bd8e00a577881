package com.ghactivity.tracker.api;

import com.ghactivity.tracker.client.EventsFetchResult;
import com.ghactivity.tracker.client.EventsFetchResult.Fetched;
import com.ghactivity.tracker.client.EventsFetchResult.RateLimited;
import com.ghactivity.tracker.client.EventsFetchResult.UpstreamError;
import com.ghactivity.tracker.client.EventsFetchResult.UserNotFound;
import com.ghactivity.tracker.client.GitHubEventsClient;
import com.ghactivity.tracker.service.ActivityAnalyzer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point: fetches a user's events, analyzes them and maps fetch failures to
 * status codes (404 for unknown users, 429 for rate limits, the upstream status or 500
 * for other upstream errors).
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "activity")
public class ActivityController {

    private static final Logger logger = LoggerFactory.getLogger(ActivityController.class);

    private final GitHubEventsClient client;
    private final ActivityAnalyzer analyzer;

    public ActivityController(GitHubEventsClient client, ActivityAnalyzer analyzer) {
        this.client = client;
        this.analyzer = analyzer;
    }

    @Operation(summary = "Get user activity",
            description = "Fetches the user's recent public GitHub events and returns them grouped by "
                    + "repository, with the top activity types per repository and whether the user "
                    + "owns it.")
    @GetMapping("/users/{username}/activity")
    public ResponseEntity<?> getUserActivity(@PathVariable("username") String username) {
        EventsFetchResult result = client.fetchEvents(username);

        if (result instanceof Fetched fetched) {
            return ResponseEntity.ok(analyzer.analyze(fetched.events(), username));
        }
        if (result instanceof UserNotFound notFound) {
            logger.info("User not found: {}", username);
            return error(HttpStatus.NOT_FOUND, notFound.message());
        }
        if (result instanceof RateLimited rateLimited) {
            logger.warn("GitHub rate limit exceeded while serving {}", username);
            ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
            if (rateLimited.hasRetryHint()) {
                builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimited.retryAfterSeconds()));
            }
            return builder.body(new ErrorResponse(rateLimited.message()));
        }
        if (result instanceof UpstreamError upstreamError) {
            logger.warn("GitHub API error for user {}: {} (status: {})",
                    username, upstreamError.message(), upstreamError.statusCode());
            return ResponseEntity.status(upstreamError.status().orElse(500))
                    .body(new ErrorResponse(upstreamError.message()));
        }
        throw new IllegalStateException("Unhandled fetch result: " + result);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(detail));
    }
}
