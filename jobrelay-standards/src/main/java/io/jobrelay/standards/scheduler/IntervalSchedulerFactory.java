package io.jobrelay.standards.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.spi.Scheduler;
import io.jobrelay.spi.SchedulerFactory;

/**
 * <code>{"interval>": "10m"}</code>. A plain number is a number of seconds.
 */
public class IntervalSchedulerFactory
        implements SchedulerFactory
{
    private final ScheduleConfigHelper configHelper;

    @Inject
    public IntervalSchedulerFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public String getType()
    {
        return "interval";
    }

    @Override
    public Scheduler newScheduler(Config config, ZoneId timeZone)
    {
        Duration interval = config.getDuration("_command", Duration.ZERO);
        if (interval.getSeconds() < 1) {
            throw new ConfigException("interval> must be 1 second or longer: " + config.get("_command", Object.class));
        }
        Optional<Instant> start = configHelper.getDateTimeStart(config, "start", timeZone);
        Optional<Instant> end = configHelper.getDateTimeEnd(config, "end", timeZone);
        configHelper.validateStartEnd(start, end);

        return new IntervalScheduler(interval, timeZone, start, end);
    }
}
