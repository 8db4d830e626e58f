package io.jobrelay.client;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;

/**
 * Compound durations used by config keys, such as "10m", "1h 30m" or "2d".
 */
public final class Durations
{
    // units in the order they must appear
    private static final ImmutableMap<Character, ChronoUnit> UNITS = ImmutableMap.of(
            'd', ChronoUnit.DAYS,
            'h', ChronoUnit.HOURS,
            'm', ChronoUnit.MINUTES,
            's', ChronoUnit.SECONDS);

    private static final Pattern TERM = Pattern.compile("(\\d+)\\s*([dhms])\\s*");

    private Durations()
    { }

    public static Duration parseDuration(CharSequence text)
    {
        String normalized = text.toString().trim().toLowerCase(Locale.ENGLISH);
        if (normalized.isEmpty()) {
            throw new DateTimeParseException("Empty duration", text, 0);
        }

        List<Character> order = new ArrayList<>(UNITS.keySet());
        int lastUnit = -1;
        Duration total = Duration.ZERO;
        Matcher matcher = TERM.matcher(normalized);
        int pos = 0;
        while (pos < normalized.length()) {
            if (!matcher.find(pos) || matcher.start() != pos) {
                throw new DateTimeParseException("Invalid duration", text, pos);
            }
            int unit = order.indexOf(matcher.group(2).charAt(0));
            if (unit <= lastUnit) {
                throw new DateTimeParseException("Duration units must be in d, h, m, s order", text, pos);
            }
            total = total.plus(Long.parseLong(matcher.group(1)), UNITS.get(order.get(unit)));
            lastUnit = unit;
            pos = matcher.end();
        }
        return total;
    }

    public static String formatDuration(Duration duration)
    {
        List<String> terms = new ArrayList<>();
        long remaining = duration.getSeconds();
        for (Map.Entry<Character, ChronoUnit> unit : UNITS.entrySet()) {
            long unitSeconds = unit.getValue().getDuration().getSeconds();
            long count = remaining / unitSeconds;
            if (count > 0) {
                terms.add(count + String.valueOf(unit.getKey()));
                remaining -= count * unitSeconds;
            }
        }
        return Joiner.on(' ').join(terms);
    }
}
