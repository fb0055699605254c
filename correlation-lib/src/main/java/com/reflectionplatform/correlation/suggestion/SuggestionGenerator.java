package com.reflectionplatform.correlation.suggestion;

import com.reflectionplatform.correlation.model.CorrelationResult;
import com.reflectionplatform.correlation.model.CorrelationSuggestion;
import com.reflectionplatform.correlation.model.DataMetric;
import com.reflectionplatform.correlation.model.MetricCategory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns ranked correlation results into prioritized, human-readable suggestions.
 *
 * <p>Only {@code MODERATE} and {@code STRONG} results produce a suggestion, one each.
 * Priority is {@code round(1 + 4 * confidence * |r|)} clamped to [1, 5], so it never
 * decreases as the strength of the underlying result increases. Output is ordered by
 * priority, highest first; equal priorities keep their input order.
 *
 * <p>The metric the user is asked to change (the lever) is the leading metric. For a
 * same-day result the generator prefers whichever side is in an actionable category.
 */
public class SuggestionGenerator {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    /** Action phrases per lever category: [0] to increase the lever, [1] to decrease it. */
    private static final Map<MetricCategory, String[]> ACTIONS = new EnumMap<>(MetricCategory.class);

    static {
        ACTIONS.put(MetricCategory.HEALTH,       new String[] {"working on improving your %s", "keeping your %s in check"});
        ACTIONS.put(MetricCategory.SLEEP,        new String[] {"making room for more %s", "trimming your %s back"});
        ACTIONS.put(MetricCategory.ACTIVITY,     new String[] {"adding more %s to your day", "easing off on %s"});
        ACTIONS.put(MetricCategory.PHONE_USAGE,  new String[] {"allowing more %s", "cutting back on %s"});
        ACTIONS.put(MetricCategory.MOOD,         new String[] {"doing more of what lifts your %s", "noticing what pushes your %s up"});
        ACTIONS.put(MetricCategory.PRODUCTIVITY, new String[] {"scheduling more %s", "scaling back %s"});
    }

    public List<CorrelationSuggestion> generateSuggestions(List<CorrelationResult> results) {
        List<CorrelationSuggestion> suggestions = new ArrayList<>();
        for (CorrelationResult result : results) {
            if (!result.significance().actionable()) continue;
            suggestions.add(toSuggestion(result));
        }
        // List.sort is stable: ties keep input order
        suggestions.sort(Comparator.comparingInt(CorrelationSuggestion::priority).reversed());
        return suggestions;
    }

    public static int priority(CorrelationResult result) {
        long raw = Math.round(1.0 + 4.0 * result.strength());
        return (int) Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, raw));
    }

    // ── templates ───────────────────────────────────────────────────────────

    private CorrelationSuggestion toSuggestion(CorrelationResult result) {
        DataMetric lever = lever(result);
        DataMetric outcome = lever == result.metricX() ? result.metricY() : result.metricX();
        return new CorrelationSuggestion(
            UUID.nameUUIDFromBytes(("suggestion|" + result.id()).getBytes(StandardCharsets.UTF_8)),
            result,
            insight(result),
            suggestedChange(result, lever, outcome),
            expectedImpact(result, outcome),
            priority(result));
    }

    static DataMetric lever(CorrelationResult result) {
        boolean xActionable = result.metricX().category().actionable();
        boolean yActionable = result.metricY().category().actionable();
        if (result.lagDays() == 0 && !xActionable && yActionable) {
            return result.metricY();
        }
        return result.metricX();
    }

    private static String insight(CorrelationResult result) {
        String direction = result.positive() ? "higher" : "lower";
        String timing = switch (result.lagDays()) {
            case 0 -> "on the same day";
            case 1 -> "the next day";
            default -> result.lagDays() + " days later";
        };
        return String.format(Locale.ROOT, "Days with higher %s tend to come with %s %s %s.",
            result.metricX().displayName(), direction, result.metricY().displayName(), timing);
    }

    private static String suggestedChange(CorrelationResult result, DataMetric lever, DataMetric outcome) {
        String[] actions = ACTIONS.get(lever.category());
        String action = String.format(Locale.ROOT, actions[result.positive() ? 0 : 1], lever.displayName());
        String advice = String.format(Locale.ROOT, "To raise your %s, try %s.", outcome.displayName(), action);
        if (!lever.category().actionable()) {
            advice += " This is an observed pattern, so track it for a few more weeks before acting on it.";
        }
        return advice;
    }

    private static String expectedImpact(CorrelationResult result, DataMetric outcome) {
        double r = result.correlationCoefficient();
        long explained = Math.round(r * r * 100);
        return String.format(Locale.ROOT,
            "Across %d days, this %s relationship accounts for about %d%% of the day-to-day variation in %s (r = %.2f).",
            result.sampleSize(), result.significance().name().toLowerCase(Locale.ROOT), explained,
            outcome.displayName(), r);
    }
}
