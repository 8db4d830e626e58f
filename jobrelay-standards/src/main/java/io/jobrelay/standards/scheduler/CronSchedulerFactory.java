package io.jobrelay.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.spi.Scheduler;
import io.jobrelay.spi.SchedulerFactory;
import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.SchedulingPattern;

public class CronSchedulerFactory
        implements SchedulerFactory
{
    private static final ImmutableMap<String, String> SHORTCUTS = ImmutableMap.of(
            "@hourly", "0 * * * *",
            "@daily", "0 0 * * *",
            "@weekly", "0 0 * * 0",
            "@monthly", "0 0 1 * *");

    private final ScheduleConfigHelper configHelper;

    @Inject
    public CronSchedulerFactory(ScheduleConfigHelper configHelper)
    {
        this.configHelper = configHelper;
    }

    @Override
    public String getType()
    {
        return "cron";
    }

    @Override
    public Scheduler newScheduler(Config config, ZoneId timeZone)
    {
        Optional<Instant> start = configHelper.getDateTimeStart(config, "start", timeZone);
        Optional<Instant> end = configHelper.getDateTimeEnd(config, "end", timeZone);
        configHelper.validateStartEnd(start, end);

        return new CronScheduler(
                parsePattern(config.get("_command", String.class)),
                timeZone,
                config.get("delay", long.class, 0L),
                start,
                end
                );
    }

    static String parsePattern(String command)
    {
        String pattern = command.trim();
        if (pattern.startsWith("@")) {
            String expanded = SHORTCUTS.get(pattern.toLowerCase());
            if (expanded == null) {
                throw new ConfigException("Unknown cron shortcut: " + command + ". Supported: " + SHORTCUTS.keySet());
            }
            return expanded;
        }
        try {
            new SchedulingPattern(pattern);
        }
        catch (InvalidPatternException ex) {
            throw new ConfigException("Invalid cron pattern: " + command, ex);
        }
        return pattern;
    }
}
