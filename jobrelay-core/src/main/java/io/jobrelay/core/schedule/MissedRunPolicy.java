package io.jobrelay.core.schedule;

import io.jobrelay.client.config.ConfigException;

import static java.util.Locale.ENGLISH;

/**
 * What happens to occurrences that fell due while nothing was polling.
 */
public enum MissedRunPolicy
{
    // skip to the first occurrence after now. one run, no backlog.
    COLLAPSE,

    // step one occurrence at a time. each missed occurrence runs on a following tick.
    CATCH_UP;

    public static MissedRunPolicy fromString(String name)
    {
        switch (name.trim().toLowerCase(ENGLISH)) {
        case "collapse":
            return COLLAPSE;
        case "catch_up":
            return CATCH_UP;
        default:
            throw new ConfigException("Unknown missed run policy: " + name + " (expected collapse or catch_up)");
        }
    }
}
