package io.eventrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.eventrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Operator tunables read from {@code eventrelay-settings.json}. Missing or out-of-range
 * values fall back to the defaults below.
 */
public record DaemonSettings(
        int maxOutstandingJobs,
        int completionThreads,
        int completionQueueCapacity,
        long completionTimeoutMs,
        int completedJobRetention,
        int eventRetention,
        int journalRetryBudget,
        long journalRetryBackoffMs,
        int replayMaxEvents,
        List<String> completionCommand,
        long completionCommandTimeoutMs,
        int requestThreads
) {
    public DaemonSettings {
        completionCommand = completionCommand == null ? List.of() : List.copyOf(completionCommand);
    }

    public static DaemonSettings defaults() {
        return new DaemonSettings(
                1_000,
                4,
                1_000,
                0L,
                10_000,
                100_000,
                3,
                50L,
                10_000,
                List.of(),
                300_000L,
                8
        );
    }

    public static DaemonSettings load(Path file) {
        DaemonSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load daemon settings: " + file, e);
        }
    }

    static DaemonSettings fromFile(SettingsFile file, DaemonSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new DaemonSettings(
                sanitizeInt(file.maxOutstandingJobs(), defaults.maxOutstandingJobs(), 1),
                sanitizeInt(file.completionThreads(), defaults.completionThreads(), 1),
                sanitizeInt(file.completionQueueCapacity(), defaults.completionQueueCapacity(), 1),
                sanitizeLong(file.completionTimeoutMs(), defaults.completionTimeoutMs(), 0L),
                sanitizeInt(file.completedJobRetention(), defaults.completedJobRetention(), 1),
                sanitizeInt(file.eventRetention(), defaults.eventRetention(), 1),
                sanitizeInt(file.journalRetryBudget(), defaults.journalRetryBudget(), 0),
                sanitizeLong(file.journalRetryBackoffMs(), defaults.journalRetryBackoffMs(), 0L),
                sanitizeInt(file.replayMaxEvents(), defaults.replayMaxEvents(), 1),
                sanitizeCommand(file.completionCommand(), defaults.completionCommand()),
                sanitizeLong(file.completionCommandTimeoutMs(), defaults.completionCommandTimeoutMs(), 1L),
                sanitizeInt(file.requestThreads(), defaults.requestThreads(), 1)
        );
    }

    public DaemonSettings withEventRetention(int value) {
        return new DaemonSettings(maxOutstandingJobs, completionThreads, completionQueueCapacity,
                completionTimeoutMs, completedJobRetention, Math.max(1, value), journalRetryBudget,
                journalRetryBackoffMs, replayMaxEvents, completionCommand, completionCommandTimeoutMs,
                requestThreads);
    }

    public DaemonSettings withMaxOutstandingJobs(int value) {
        return new DaemonSettings(Math.max(1, value), completionThreads, completionQueueCapacity,
                completionTimeoutMs, completedJobRetention, eventRetention, journalRetryBudget,
                journalRetryBackoffMs, replayMaxEvents, completionCommand, completionCommandTimeoutMs,
                requestThreads);
    }

    public DaemonSettings withCompletionTimeoutMs(long value) {
        return new DaemonSettings(maxOutstandingJobs, completionThreads, completionQueueCapacity,
                Math.max(0L, value), completedJobRetention, eventRetention, journalRetryBudget,
                journalRetryBackoffMs, replayMaxEvents, completionCommand, completionCommandTimeoutMs,
                requestThreads);
    }

    public DaemonSettings withCompletedJobRetention(int value) {
        return new DaemonSettings(maxOutstandingJobs, completionThreads, completionQueueCapacity,
                completionTimeoutMs, Math.max(1, value), eventRetention, journalRetryBudget,
                journalRetryBackoffMs, replayMaxEvents, completionCommand, completionCommandTimeoutMs,
                requestThreads);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static List<String> sanitizeCommand(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw.stream()
                .filter(part -> part != null && !part.isBlank())
                .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxOutstandingJobs,
            Integer completionThreads,
            Integer completionQueueCapacity,
            Long completionTimeoutMs,
            Integer completedJobRetention,
            Integer eventRetention,
            Integer journalRetryBudget,
            Long journalRetryBackoffMs,
            Integer replayMaxEvents,
            List<String> completionCommand,
            Long completionCommandTimeoutMs,
            Integer requestThreads
    ) {
    }
}
