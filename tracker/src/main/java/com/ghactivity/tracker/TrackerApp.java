package com.ghactivity.tracker;

import com.ghactivity.tracker.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

/**
 * Main entry point for the GitHub Activity Tracker service.
 * Loads configuration, starts the HTTP server and serves
 * {@code GET /api/v1/users/{username}/activity}, with the OpenAPI document at
 * {@code /openapi.json} and the docs UI at {@code /docs}.
 *
 * <p>Usage:
 * <pre>
 *   java -jar tracker.jar
 * </pre>
 * Settings come from the environment or a {@code .env} file; see {@link AppConfig}.
 */
@SpringBootApplication
public class TrackerApp {

    private static final Logger logger = LoggerFactory.getLogger(TrackerApp.class);

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig();
            createApplication(config).run(args);
            logger.info("GitHub Activity Tracker listening on {}:{}", config.getApiHost(), config.getApiPort());
        } catch (Exception e) {
            logger.error("Fatal error during startup", e);
            System.exit(1);
        }
    }

    static SpringApplication createApplication(AppConfig config) {
        SpringApplication application = new SpringApplication(TrackerApp.class);
        application.setDefaultProperties(serverProperties(config));
        application.addInitializers(context ->
                context.getBeanFactory().registerSingleton("appConfig", config));
        return application;
    }

    static Map<String, Object> serverProperties(AppConfig config) {
        return Map.of(
                "spring.application.name", "github-activity-tracker",
                "server.address", config.getApiHost(),
                "server.port", config.getApiPort(),
                "logging.level.root", config.getLogLevel(),
                "springdoc.api-docs.path", "/openapi.json",
                "springdoc.swagger-ui.path", "/docs");
    }
}
