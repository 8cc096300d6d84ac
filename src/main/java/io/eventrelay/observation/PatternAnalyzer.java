package io.eventrelay.observation;

import io.eventrelay.error.ValidationException;
import io.eventrelay.log.EventLog;
import io.eventrelay.log.EventPatterns;
import io.eventrelay.model.Event;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class PatternAnalyzer {
    public static final int DEFAULT_LIMIT = 1_000;

    private final EventLog eventLog;

    public PatternAnalyzer(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    public Analysis analyze(Collection<String> patterns, String target, String type, int limit) {
        AnalysisType analysisType = AnalysisType.parse(type);
        Set<String> validated = EventPatterns.normalize(patterns);
        List<Event> window = eventLog.latest(event ->
                        (target == null || target.equals(event.origin()))
                                && EventPatterns.matchesAny(validated, event.name()),
                Math.max(1, limit));
        return analyze(window, analysisType);
    }

    static Analysis analyze(List<Event> window, AnalysisType type) {
        return switch (type) {
            case FREQUENCY -> frequency(window);
            case SEQUENCE -> sequences(window);
            case ORIGINS -> origins(window);
        };
    }

    private static Analysis frequency(List<Event> window) {
        Map<String, Long> counts = new HashMap<>();
        Map<Integer, Long> hourly = new TreeMap<>();
        for (Event event : window) {
            counts.merge(event.name(), 1L, Long::sum);
            int hour = Instant.ofEpochMilli(event.timestampMs()).atZone(ZoneOffset.UTC).getHour();
            hourly.merge(hour, 1L, Long::sum);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        Map<String, Long> byHour = new LinkedHashMap<>();
        hourly.forEach((hour, count) -> byHour.put(String.format(Locale.ROOT, "%02d", hour), count));
        details.put("hourly_distribution", byHour);
        return new Analysis(AnalysisType.FREQUENCY.wireName(), window.size(), sortedCounts(counts), details);
    }

    private static Analysis sequences(List<Event> window) {
        Map<String, String> previousByOrigin = new HashMap<>();
        Map<String, Long> pairs = new HashMap<>();
        for (Event event : window) {
            String key = event.origin() == null ? "" : event.origin();
            String previous = previousByOrigin.put(key, event.name());
            if (previous != null) {
                pairs.merge(previous + " -> " + event.name(), 1L, Long::sum);
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("origins", previousByOrigin.size());
        return new Analysis(AnalysisType.SEQUENCE.wireName(), window.size(), sortedCounts(pairs), details);
    }

    private static Analysis origins(List<Event> window) {
        Map<String, Long> counts = new HashMap<>();
        for (Event event : window) {
            counts.merge(event.origin() == null ? "(none)" : event.origin(), 1L, Long::sum);
        }
        return new Analysis(AnalysisType.ORIGINS.wireName(), window.size(), sortedCounts(counts), Map.of());
    }

    /** Descending by count, ties broken by key. */
    private static Map<String, Long> sortedCounts(Map<String, Long> counts) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort((a, b) -> {
            int byCount = Long.compare(b.getValue(), a.getValue());
            return byCount != 0 ? byCount : a.getKey().compareTo(b.getKey());
        });
        Map<String, Long> out = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            out.put(entry.getKey(), entry.getValue());
        }
        return out;
    }

    public enum AnalysisType {
        FREQUENCY,
        SEQUENCE,
        ORIGINS;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        static AnalysisType parse(String raw) {
            if (raw == null || raw.isBlank()) {
                return FREQUENCY;
            }
            for (AnalysisType type : values()) {
                if (type.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                    return type;
                }
            }
            throw new ValidationException("unknown analysis type: " + raw
                    + " (expected frequency, sequence or origins)");
        }
    }

    public record Analysis(
            String type,
            int totalEvents,
            Map<String, Long> counts,
            Map<String, Object> details
    ) {
    }
}
