package io.eventrelay.log;

import io.eventrelay.error.InvalidPatternException;
import io.eventrelay.error.ValidationException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Colon-segmented glob matching over event names. A bare {@code *} matches every name;
 * otherwise the pattern and the name need the same number of segments and each pattern
 * segment is a glob where {@code *} matches any run of characters inside that segment.
 */
public final class EventPatterns {
    public static final String MATCH_ALL = "*";

    private EventPatterns() {
    }

    public static boolean matches(String pattern, String name) {
        if (pattern == null || name == null) {
            return false;
        }
        if (MATCH_ALL.equals(pattern)) {
            return true;
        }
        String[] patternParts = pattern.split(":", -1);
        String[] nameParts = name.split(":", -1);
        if (patternParts.length != nameParts.length) {
            return false;
        }
        for (int i = 0; i < patternParts.length; i++) {
            if (!globMatches(patternParts[i], nameParts[i])) {
                return false;
            }
        }
        return true;
    }

    public static boolean matchesAny(Collection<String> patterns, String name) {
        if (patterns == null || patterns.isEmpty()) {
            return true;
        }
        for (String pattern : patterns) {
            if (matches(pattern, name)) {
                return true;
            }
        }
        return false;
    }

    public static String validate(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidPatternException(String.valueOf(pattern), "pattern is blank");
        }
        String trimmed = pattern.trim();
        for (String segment : trimmed.split(":", -1)) {
            if (segment.isEmpty()) {
                throw new InvalidPatternException(pattern, "empty segment");
            }
            for (int i = 0; i < segment.length(); i++) {
                char ch = segment.charAt(i);
                if (!isNameChar(ch) && ch != '*') {
                    throw new InvalidPatternException(pattern, "unsupported character '" + ch + "'");
                }
            }
        }
        return trimmed;
    }

    /** Validates every pattern; an empty or missing collection means "everything". */
    public static Set<String> normalize(Collection<String> patterns) {
        Set<String> out = new LinkedHashSet<>();
        if (patterns == null || patterns.isEmpty()) {
            out.add(MATCH_ALL);
            return out;
        }
        for (String pattern : patterns) {
            out.add(validate(pattern));
        }
        return out;
    }

    public static String validateEventName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("event name is required");
        }
        String trimmed = name.trim();
        String[] parts = trimmed.split(":", -1);
        if (parts.length < 2) {
            throw new ValidationException("event name must look like namespace:verb: " + trimmed);
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new ValidationException("event name has an empty segment: " + trimmed);
            }
            for (int i = 0; i < part.length(); i++) {
                if (!isNameChar(part.charAt(i))) {
                    throw new ValidationException("event name has unsupported character '"
                            + part.charAt(i) + "': " + trimmed);
                }
            }
        }
        return trimmed;
    }

    private static boolean isNameChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= 'A' && ch <= 'Z')
                || (ch >= '0' && ch <= '9')
                || ch == '_' || ch == '-' || ch == '.';
    }

    private static boolean globMatches(String glob, String text) {
        int g = 0;
        int t = 0;
        int star = -1;
        int mark = 0;
        while (t < text.length()) {
            if (g < glob.length() && glob.charAt(g) != '*' && glob.charAt(g) == text.charAt(t)) {
                g++;
                t++;
            } else if (g < glob.length() && glob.charAt(g) == '*') {
                star = g++;
                mark = t;
            } else if (star >= 0) {
                g = star + 1;
                t = ++mark;
            } else {
                return false;
            }
        }
        while (g < glob.length() && glob.charAt(g) == '*') {
            g++;
        }
        return g == glob.length();
    }
}
