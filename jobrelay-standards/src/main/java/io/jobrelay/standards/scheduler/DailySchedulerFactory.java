package io.jobrelay.standards.scheduler;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.spi.Scheduler;
import io.jobrelay.spi.SchedulerFactory;

/**
 * <code>{"daily>": "07:30:00"}</code>, or <code>{"daily>": null, "at": "07:30:00"}</code>.
 * Runs once a day at the given local time of the rule's time zone.
 */
public class DailySchedulerFactory
        implements SchedulerFactory
{
    // every midnight. the time of day is applied as a delay.
    private static final String MIDNIGHT = "0 0 * * *";

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter
        .ofPattern("HH:mm:ss", Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);

    private final ScheduleConfigHelper configHelper;

    @Inject
    public DailySchedulerFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public String getType()
    {
        return "daily";
    }

    @Override
    public Scheduler newScheduler(Config config, ZoneId timeZone)
    {
        String at = config.getOptional("_command", String.class).isPresent()
            ? config.get("_command", String.class)
            : config.get("at", String.class);
        long secondOfDay = parseAt("daily>", at);

        return configHelper.checkRange(new CronScheduler(MIDNIGHT, timeZone, secondOfDay,
                configHelper.getDateTimeStart(config, "start", timeZone),
                configHelper.getDateTimeEnd(config, "end", timeZone)));
    }

    /**
     * Parses hh:mm:ss into seconds since midnight.
     */
    static long parseAt(String kind, String at)
    {
        try {
            return LocalTime.parse(at.trim(), TIME_OF_DAY).toSecondOfDay();
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException(kind + " scheduler requires hh:mm:ss format: " + at, ex);
        }
    }
}
