package com.ghactivity.tracker.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Every variable has a default;
 * values are validated on startup and all problems are reported together.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final String DEFAULT_BASE_URL = "https://api.github.com";
    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final int DEFAULT_CACHE_TTL_SECONDS = 600;
    static final int DEFAULT_CACHE_MAX_SIZE = 1000;
    static final String DEFAULT_API_HOST = "0.0.0.0";
    static final int DEFAULT_API_PORT = 8000;
    static final String DEFAULT_LOG_LEVEL = "INFO";
    static final String DEFAULT_API_TITLE = "GitHub Activity Tracker";
    static final String DEFAULT_API_VERSION = "1.0.0";

    // Accepted LOG_LEVEL spellings mapped to Logback level names
    private static final Map<String, String> LOG_LEVELS = Map.of(
            "TRACE", "TRACE",
            "DEBUG", "DEBUG",
            "INFO", "INFO",
            "WARN", "WARN",
            "WARNING", "WARN",
            "ERROR", "ERROR",
            "CRITICAL", "ERROR");

    private final String githubApiBaseUrl;
    private final int requestTimeoutSeconds;
    private final int cacheTtlSeconds;
    private final int cacheMaxSize;
    private final String apiHost;
    private final int apiPort;
    private final String logLevel;
    private final String apiTitle;
    private final String apiVersion;

    public AppConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    AppConfig(Dotenv dotenv) {
        List<String> problems = new ArrayList<>();

        this.githubApiBaseUrl = stripTrailingSlash(resolve(dotenv, "GITHUB_API_BASE_URL", DEFAULT_BASE_URL));
        this.requestTimeoutSeconds = resolveInt(dotenv, "REQUEST_TIMEOUT_SECONDS", DEFAULT_TIMEOUT_SECONDS, problems);
        this.cacheTtlSeconds = resolveInt(dotenv, "CACHE_TTL_SECONDS", DEFAULT_CACHE_TTL_SECONDS, problems);
        this.cacheMaxSize = resolveInt(dotenv, "CACHE_MAX_SIZE", DEFAULT_CACHE_MAX_SIZE, problems);
        this.apiHost = resolve(dotenv, "API_HOST", DEFAULT_API_HOST);
        this.apiPort = resolveInt(dotenv, "API_PORT", DEFAULT_API_PORT, problems);
        this.logLevel = resolve(dotenv, "LOG_LEVEL", DEFAULT_LOG_LEVEL);
        this.apiTitle = resolve(dotenv, "API_TITLE", DEFAULT_API_TITLE);
        this.apiVersion = resolve(dotenv, "API_VERSION", DEFAULT_API_VERSION);

        validate(problems);

        logger.info("Configuration loaded: githubApiBaseUrl={}, requestTimeoutSeconds={}, "
                        + "cacheTtlSeconds={}, cacheMaxSize={}, api={}:{}",
                githubApiBaseUrl, requestTimeoutSeconds, cacheTtlSeconds, cacheMaxSize, apiHost, apiPort);
    }

    /**
     * Constructor for testing; accepts values directly.
     */
    public AppConfig(String githubApiBaseUrl, int requestTimeoutSeconds, int cacheTtlSeconds,
                     int cacheMaxSize, String apiHost, int apiPort, String logLevel) {
        this(githubApiBaseUrl, requestTimeoutSeconds, cacheTtlSeconds, cacheMaxSize, apiHost, apiPort,
                logLevel, DEFAULT_API_TITLE, DEFAULT_API_VERSION);
    }

    public AppConfig(String githubApiBaseUrl, int requestTimeoutSeconds, int cacheTtlSeconds,
                     int cacheMaxSize, String apiHost, int apiPort, String logLevel,
                     String apiTitle, String apiVersion) {
        this.githubApiBaseUrl = stripTrailingSlash(githubApiBaseUrl);
        this.requestTimeoutSeconds = requestTimeoutSeconds;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.cacheMaxSize = cacheMaxSize;
        this.apiHost = apiHost;
        this.apiPort = apiPort;
        this.logLevel = logLevel;
        this.apiTitle = apiTitle;
        this.apiVersion = apiVersion;

        validate(new ArrayList<>());
    }

    private void validate(List<String> problems) {
        if (!isValidBaseUrl(githubApiBaseUrl)) {
            problems.add("GITHUB_API_BASE_URL (must be an absolute http(s) URL, got '" + githubApiBaseUrl + "')");
        }
        requirePositive("REQUEST_TIMEOUT_SECONDS", requestTimeoutSeconds, problems);
        requirePositive("CACHE_TTL_SECONDS", cacheTtlSeconds, problems);
        requirePositive("CACHE_MAX_SIZE", cacheMaxSize, problems);
        if (isBlank(apiHost)) {
            problems.add("API_HOST (must not be blank)");
        }
        if (apiPort < 1 || apiPort > 65535) {
            problems.add("API_PORT (must be between 1 and 65535, got " + apiPort + ")");
        }
        if (isBlank(logLevel) || !LOG_LEVELS.containsKey(logLevel.trim().toUpperCase(Locale.ROOT))) {
            problems.add("LOG_LEVEL (must be one of TRACE, DEBUG, INFO, WARN, WARNING, ERROR, CRITICAL, got '"
                    + logLevel + "')");
        }

        if (isBlank(apiTitle)) {
            problems.add("API_TITLE (must not be blank)");
        }
        if (isBlank(apiVersion)) {
            problems.add("API_VERSION (must not be blank)");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid environment variables: " + String.join(", ", problems));
        }
    }

    private static void requirePositive(String key, int value, List<String> problems) {
        if (value <= 0) {
            problems.add(key + " (must be positive, got " + value + ")");
        }
    }

    static boolean isValidBaseUrl(String value) {
        if (isBlank(value)) {
            return false;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && !isBlank(uri.getHost());
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String resolve(Dotenv dotenv, String key, String defaultValue) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue.trim();
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null && !dotenvValue.isBlank() ? dotenvValue.trim() : defaultValue;
    }

    private static int resolveInt(Dotenv dotenv, String key, int defaultValue, List<String> problems) {
        String raw = resolve(dotenv, key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            problems.add(key + " (not an integer: '" + raw + "')");
            return defaultValue;
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getGithubApiBaseUrl() {
        return githubApiBaseUrl;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public String getApiHost() {
        return apiHost;
    }

    public int getApiPort() {
        return apiPort;
    }

    public String getApiTitle() {
        return apiTitle;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    /**
     * Log level as a Logback level name (WARNING and CRITICAL are mapped to WARN and ERROR).
     */
    public String getLogLevel() {
        return LOG_LEVELS.get(logLevel.trim().toUpperCase(Locale.ROOT));
    }
}
