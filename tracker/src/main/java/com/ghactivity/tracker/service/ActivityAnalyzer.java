package com.ghactivity.tracker.service;

import com.ghactivity.tracker.model.ActivityTypeCount;
import com.ghactivity.tracker.model.Event;
import com.ghactivity.tracker.model.RepositoryActivitySummary;
import com.ghactivity.tracker.model.RepositoryRef;
import com.ghactivity.tracker.model.UserActivityReport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a flat list of GitHub events into per-repository activity summaries.
 *
 * <p>Output is deterministic: repositories keep the order in which they first appear in
 * the input, and activity types with equal counts keep the order in which they were
 * first seen within their repository. Stateless and thread-safe.</p>
 */
public class ActivityAnalyzer {

    static final int TOP_ACTIVITY_TYPES = 3;

    /**
     * Analyzes {@code events} on behalf of {@code username}. Never fails; an empty event
     * list produces an empty report.
     */
    public UserActivityReport analyze(List<Event> events, String username) {
        if (events.isEmpty()) {
            return UserActivityReport.empty(username);
        }

        List<RepositoryActivitySummary> repositories = new ArrayList<>();
        for (List<Event> group : groupByRepository(events).values()) {
            RepositoryRef repo = group.get(0).repo();
            repositories.add(new RepositoryActivitySummary(
                    repo.fullName(),
                    isOwner(repo, username),
                    topActivityTypes(group, TOP_ACTIVITY_TYPES)));
        }

        return new UserActivityReport(username, repositories, repositories.size(), events.size());
    }

    /**
     * Groups events by repository full name, in first-seen order.
     */
    Map<String, List<Event>> groupByRepository(List<Event> events) {
        Map<String, List<Event>> groups = new LinkedHashMap<>();
        for (Event event : events) {
            groups.computeIfAbsent(event.repo().fullName(), name -> new ArrayList<>()).add(event);
        }
        return groups;
    }

    /**
     * Most frequent activity types, highest count first. List.sort is stable, so ties
     * stay in first-seen order.
     */
    List<ActivityTypeCount> topActivityTypes(List<Event> events, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Event event : events) {
            counts.merge(event.activityType(), 1, Integer::sum);
        }

        List<ActivityTypeCount> ranked = new ArrayList<>();
        counts.forEach((type, count) -> ranked.add(new ActivityTypeCount(type, count)));
        ranked.sort(Comparator.comparingInt(ActivityTypeCount::count).reversed());

        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    }

    boolean isOwner(RepositoryRef repo, String username) {
        return repo.owner().toLowerCase(Locale.ROOT).equals(username.toLowerCase(Locale.ROOT));
    }
}
