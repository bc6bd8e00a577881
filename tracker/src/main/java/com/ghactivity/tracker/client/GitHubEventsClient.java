package com.ghactivity.tracker.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ghactivity.tracker.cache.TtlCache;
import com.ghactivity.tracker.client.EventsFetchResult.Fetched;
import com.ghactivity.tracker.client.EventsFetchResult.RateLimited;
import com.ghactivity.tracker.client.EventsFetchResult.UpstreamError;
import com.ghactivity.tracker.client.EventsFetchResult.UserNotFound;
import com.ghactivity.tracker.model.Event;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * GitHub REST client for a user's public events, fronted by a {@link TtlCache}.
 *
 * <p>One cache miss costs exactly one upstream round trip; there is no pagination and
 * no retry. Every failure is reported as an {@link EventsFetchResult} variant rather
 * than thrown, and failures are never cached.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient}, {@link ObjectMapper} and cache are
 * all thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GitHubEventsClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubEventsClient.class);

    static final String CACHE_KEY_PREFIX = "github_events:";
    static final String USER_AGENT = "GitHubActivityTracker/1.0.0";

    private static final TypeReference<List<Event>> EVENT_LIST = new TypeReference<>() {};

    private final HttpUrl baseUrl;
    private final TtlCache<List<Event>> cache;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubEventsClient(String baseUrl, int timeoutSeconds, TtlCache<List<Event>> cache) {
        this(baseUrl, cache, defaultHttpClient(timeoutSeconds));
    }

    public GitHubEventsClient(String baseUrl, TtlCache<List<Event>> cache, OkHttpClient httpClient) {
        this.baseUrl = HttpUrl.get(baseUrl);
        this.cache = cache;
        this.httpClient = httpClient;
        this.objectMapper = eventMapper();
    }

    // Strict about scalar types: 1.9 is not a long and 42 is not a String
    private static ObjectMapper eventMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .withCoercionConfig(LogicalType.Textual, textual -> textual
                        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
                .build();
    }

    /**
     * Builds an HTTP client whose whole call (connect, write, read) is bounded by
     * {@code timeoutSeconds}.
     */
    public static OkHttpClient defaultHttpClient(int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, got " + timeoutSeconds);
        }
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Returns the user's recent public events, from the cache when possible.
     * Endpoint: GET /users/{username}/events
     */
    public EventsFetchResult fetchEvents(String username) {
        String cacheKey = cacheKey(username);
        Optional<List<Event>> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Cache hit for {} ({} events)", username, cached.get().size());
            return new Fetched(cached.get());
        }

        EventsFetchResult result = fetchFromApi(username);
        if (result instanceof Fetched fetched) {
            cache.set(cacheKey, fetched.events());
        }
        return result;
    }

    static String cacheKey(String username) {
        return CACHE_KEY_PREFIX + username;
    }

    // -------------------------------------------------------------------------
    // Upstream call
    // -------------------------------------------------------------------------

    EventsFetchResult fetchFromApi(String username) {
        Request request = buildRequest(eventsUrl(username));

        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            logResponse(request.url().toString(), statusCode, response);

            if (statusCode == 404) {
                return new UserNotFound(username);
            }
            if (statusCode == 429) {
                long retryAfter = parseRetryAfter(response.header("Retry-After"));
                logger.warn("GitHub rate limit hit for {} (retry after {}s)", username, retryAfter);
                return new RateLimited(retryAfter);
            }
            if (statusCode < 200 || statusCode >= 300) {
                return UpstreamError.withStatus("GitHub API error: " + statusCode, statusCode);
            }

            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : "";
            return parseEvents(bodyString);

        } catch (IOException e) {
            logger.warn("Request to {} failed: {}", request.url(), e.toString());
            return UpstreamError.withoutStatus("Request error: " + e.getMessage());
        }
    }

    EventsFetchResult parseEvents(String json) {
        try {
            List<Event> events = objectMapper.readValue(json, EVENT_LIST);
            if (events == null) {
                return UpstreamError.withoutStatus("Invalid response body: expected a JSON array");
            }
            if (events.contains(null)) {
                return UpstreamError.withoutStatus("Invalid response body: null event record");
            }
            return new Fetched(events);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Could not parse GitHub events response: {}", e.getMessage());
            return UpstreamError.withoutStatus("Invalid response body: " + e.getMessage());
        }
    }

    HttpUrl eventsUrl(String username) {
        return baseUrl.newBuilder()
                .addPathSegment("users")
                .addPathSegment(username)
                .addPathSegment("events")
                .build();
    }

    Request buildRequest(HttpUrl url) {
        return new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .header("User-Agent", USER_AGENT)
                .get()
                .build();
    }

    /**
     * Reads a delta-seconds {@code Retry-After} value; anything else counts as no hint.
     */
    static long parseRetryAfter(String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) {
            return 0;
        }
        try {
            return Math.max(Long.parseLong(retryAfter.trim()), 0);
        } catch (NumberFormatException ignored) {
            // HTTP-date form is not used by GitHub
            return 0;
        }
    }

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }
}
