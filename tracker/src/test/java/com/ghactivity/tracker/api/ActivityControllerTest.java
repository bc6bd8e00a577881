package com.ghactivity.tracker.api;

import com.ghactivity.tracker.client.EventsFetchResult;
import com.ghactivity.tracker.client.GitHubEventsClient;
import com.ghactivity.tracker.model.Event;
import com.ghactivity.tracker.model.RepositoryRef;
import com.ghactivity.tracker.service.ActivityAnalyzer;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web-layer tests for {@link ActivityController}. The GitHub client is mocked; the
 * analyzer is real so the JSON shape of a full report is checked end to end.
 */
@ExtendWith(MockitoExtension.class)
class ActivityControllerTest {

    @Mock
    private GitHubEventsClient client;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ActivityController(client, new ActivityAnalyzer()), new HealthController())
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static Event event(long id, String repoName, String type) {
        return new Event(id, type, new Event.Actor("ge0ffrey", 7),
                new RepositoryRef(id, repoName, "https://api.github.com/repos/" + repoName),
                OffsetDateTime.of(2026, 1, 15, 10, 30, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("GET /api/v1/users/{username}/activity returns the analyzed report")
    void activity_ok() throws Exception {
        when(client.fetchEvents("ge0ffrey")).thenReturn(new EventsFetchResult.Fetched(List.of(
                event(1, "ge0ffrey/test-repo", "PushEvent"),
                event(2, "ge0ffrey/test-repo", "PushEvent"),
                event(3, "kiegroup/optaplanner", "WatchEvent"))));

        mockMvc.perform(get("/api/v1/users/ge0ffrey/activity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("ge0ffrey"))
                .andExpect(jsonPath("$.total_repositories").value(2))
                .andExpect(jsonPath("$.total_events").value(3))
                .andExpect(jsonPath("$.repositories[0].repository_name").value("ge0ffrey/test-repo"))
                .andExpect(jsonPath("$.repositories[0].is_owner").value(true))
                .andExpect(jsonPath("$.repositories[0].top_activity_types[0].type").value("PushEvent"))
                .andExpect(jsonPath("$.repositories[0].top_activity_types[0].count").value(2))
                .andExpect(jsonPath("$.repositories[1].repository_name").value("kiegroup/optaplanner"))
                .andExpect(jsonPath("$.repositories[1].is_owner").value(false));
    }

    @Test
    @DisplayName("User without events gets an empty report")
    void activity_empty() throws Exception {
        when(client.fetchEvents("testuser")).thenReturn(new EventsFetchResult.Fetched(List.of()));

        mockMvc.perform(get("/api/v1/users/testuser/activity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("testuser"))
                .andExpect(jsonPath("$.repositories").isEmpty())
                .andExpect(jsonPath("$.total_repositories").value(0))
                .andExpect(jsonPath("$.total_events").value(0));
    }

    @Test
    @DisplayName("Unknown user maps to 404 with a detail message")
    void activity_notFound() throws Exception {
        when(client.fetchEvents("nonexistent")).thenReturn(new EventsFetchResult.UserNotFound("nonexistent"));

        mockMvc.perform(get("/api/v1/users/nonexistent/activity"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("User 'nonexistent' not found"));
    }

    @Test
    @DisplayName("Rate limit maps to 429 and forwards Retry-After")
    void activity_rateLimited() throws Exception {
        when(client.fetchEvents("busy")).thenReturn(new EventsFetchResult.RateLimited(60));

        mockMvc.perform(get("/api/v1/users/busy/activity"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(jsonPath("$.detail").value("GitHub API rate limit exceeded. Retry after 60 seconds"));
    }

    @Test
    @DisplayName("Rate limit without a hint sends no Retry-After header")
    void activity_rateLimitedWithoutHint() throws Exception {
        when(client.fetchEvents("busy")).thenReturn(new EventsFetchResult.RateLimited(0));

        mockMvc.perform(get("/api/v1/users/busy/activity"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().doesNotExist("Retry-After"));
    }

    @Test
    @DisplayName("Upstream error keeps the upstream status code")
    void activity_upstreamStatus() throws Exception {
        when(client.fetchEvents("testuser"))
                .thenReturn(EventsFetchResult.UpstreamError.withStatus("GitHub API error: 503", 503));

        mockMvc.perform(get("/api/v1/users/testuser/activity"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").value("GitHub API error: 503"));
    }

    @Test
    @DisplayName("Upstream error without a status maps to 500")
    void activity_upstreamWithoutStatus() throws Exception {
        when(client.fetchEvents("testuser"))
                .thenReturn(EventsFetchResult.UpstreamError.withoutStatus("Request error: timeout"));

        mockMvc.perform(get("/api/v1/users/testuser/activity"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Request error: timeout"));
    }

    @Test
    @DisplayName("Unexpected faults map to a generic 500")
    void activity_unexpectedFault() throws Exception {
        when(client.fetchEvents("testuser")).thenThrow(new IllegalStateException("cache misconfigured"));

        mockMvc.perform(get("/api/v1/users/testuser/activity"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value(ApiExceptionHandler.INTERNAL_ERROR_DETAIL));
    }

    @Test
    @DisplayName("A result the controller does not recognise maps to a generic 500")
    void activity_unrecognisedResult() throws Exception {
        when(client.fetchEvents("testuser")).thenReturn(null);

        mockMvc.perform(get("/api/v1/users/testuser/activity"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value(ApiExceptionHandler.INTERNAL_ERROR_DETAIL));
    }

    @Test
    @DisplayName("Health endpoint reports UP")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
        verifyNoInteractions(client);
    }
}
