package fr.lapetina.orchestrator.domain.model;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named traffic rule bound to a target service or to every service ({@code *}).
 *
 * The configuration bag is kind-specific; typed accessors below read it
 * leniently (numbers may arrive as any {@link Number}, durations as
 * milliseconds or as strings like {@code 30s}).
 */
public record Policy(
        String id,
        PolicyType type,
        String target,
        Map<String, Object> configuration,
        boolean enabled
) {

    public static final String WILDCARD = "*";

    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    public Policy {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        if (target == null || target.isBlank()) {
            target = WILDCARD;
        }
        configuration = configuration != null ? Map.copyOf(configuration) : Map.of();
    }

    public static Policy of(String id, PolicyType type, String target, Map<String, Object> configuration) {
        return new Policy(id, type, target, configuration, true);
    }

    public boolean appliesTo(String serviceId) {
        return enabled && (WILDCARD.equals(target) || target.equals(serviceId));
    }

    public int intValue(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Integer.parseInt(text.trim());
        }
        return defaultValue;
    }

    public String stringValue(String key, String defaultValue) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Reads a list of strings; a single string is treated as a one-element list.
     */
    public List<String> stringList(String key) {
        Object value = configuration.get(key);
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        if (value != null) {
            return List.of(value.toString());
        }
        return List.of();
    }

    public Duration durationValue(String key, Duration defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number number) {
            return Duration.ofMillis(number.longValue());
        }
        if (value instanceof String text) {
            return parseDuration(text);
        }
        return defaultValue;
    }

    static Duration parseDuration(String text) {
        Matcher matcher = DURATION.matcher(text.trim().toLowerCase());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2);
        if (unit == null || unit.equals("ms")) {
            return Duration.ofMillis(amount);
        }
        return switch (unit) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            default -> Duration.ofHours(amount);
        };
    }
}
