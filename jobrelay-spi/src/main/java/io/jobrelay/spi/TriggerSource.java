package io.jobrelay.spi;

import static java.util.Locale.ENGLISH;

/**
 * Origin of a job execution. Every source goes through the same execution path.
 */
public enum TriggerSource
{
    SCHEDULER,
    WEBHOOK,
    FILE,
    MANUAL,
    COMPLETION;

    public String toConfigString()
    {
        return name().toLowerCase(ENGLISH);
    }
}
