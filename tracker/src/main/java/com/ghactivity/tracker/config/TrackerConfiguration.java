package com.ghactivity.tracker.config;

import com.ghactivity.tracker.cache.TtlCache;
import com.ghactivity.tracker.client.GitHubEventsClient;
import com.ghactivity.tracker.model.Event;
import com.ghactivity.tracker.service.ActivityAnalyzer;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the process-wide components from {@link AppConfig}. The config itself is
 * created in {@code TrackerApp.main} and registered before the context refreshes.
 */
@Configuration
public class TrackerConfiguration {

    @Bean
    public TtlCache<List<Event>> eventsCache(AppConfig config) {
        return new TtlCache<>(config.getCacheTtlSeconds(), config.getCacheMaxSize());
    }

    @Bean
    public OkHttpClient gitHubHttpClient(AppConfig config) {
        return GitHubEventsClient.defaultHttpClient(config.getRequestTimeoutSeconds());
    }

    @Bean
    public GitHubEventsClient gitHubEventsClient(AppConfig config, TtlCache<List<Event>> eventsCache,
                                                 OkHttpClient gitHubHttpClient) {
        return new GitHubEventsClient(config.getGithubApiBaseUrl(), eventsCache, gitHubHttpClient);
    }

    @Bean
    public ActivityAnalyzer activityAnalyzer() {
        return new ActivityAnalyzer();
    }

    @Bean
    public OpenAPI trackerOpenApi(AppConfig config) {
        return new OpenAPI().info(new Info()
                .title(config.getApiTitle())
                .version(config.getApiVersion())
                .description("Per-repository summaries of a GitHub user's recent public activity"));
    }
}
