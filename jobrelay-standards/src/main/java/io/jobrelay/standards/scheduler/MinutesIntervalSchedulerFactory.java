package io.jobrelay.standards.scheduler;

import java.time.ZoneId;
import com.google.common.collect.Range;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.spi.Scheduler;
import io.jobrelay.spi.SchedulerFactory;

/**
 * <code>{"minutes_interval>": 15}</code>. Occurrences are at minutes of the
 * hour divisible by the value, so they restart at each full hour.
 */
public class MinutesIntervalSchedulerFactory
        implements SchedulerFactory
{
    private static final Range<Integer> VALID_MINUTES = Range.closed(1, 59);

    private final ScheduleConfigHelper configHelper;

    @Inject
    public MinutesIntervalSchedulerFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public String getType()
    {
        return "minutes_interval";
    }

    @Override
    public Scheduler newScheduler(Config config, ZoneId timeZone)
    {
        int minutes = config.get("_command", int.class);
        if (!VALID_MINUTES.contains(minutes)) {
            throw new ConfigException(String.format("minutes_interval> must be in %s but got %d", VALID_MINUTES, minutes));
        }
        String pattern = String.format("*/%d * * * *", minutes);

        return configHelper.checkRange(new CronScheduler(pattern, timeZone,
                config.get("delay", long.class, 0L),
                configHelper.getDateTimeStart(config, "start", timeZone),
                configHelper.getDateTimeEnd(config, "end", timeZone)));
    }
}
