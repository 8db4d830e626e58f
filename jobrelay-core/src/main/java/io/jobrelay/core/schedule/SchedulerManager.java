package io.jobrelay.core.schedule;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.spi.Scheduler;
import io.jobrelay.spi.SchedulerFactory;

import static java.util.stream.Collectors.toList;

/**
 * Builds a {@link Scheduler} out of a recurrence rule such as
 * <code>{"cron>": "0 9 * * *", "timezone": "Asia/Tokyo"}</code>.
 */
public class SchedulerManager
{
    private final Map<String, SchedulerFactory> types;

    @Inject
    public SchedulerManager(Set<SchedulerFactory> factories)
    {
        ImmutableMap.Builder<String, SchedulerFactory> builder = ImmutableMap.builder();
        for (SchedulerFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.types = builder.build();
    }

    public Optional<Scheduler> tryGetScheduler(Optional<Config> recurrence)
    {
        if (!recurrence.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(getScheduler(recurrence.get()));
    }

    public Scheduler getScheduler(Config recurrence)
    {
        Config c = recurrence.deepCopy();

        List<String> operatorKeys = c.getKeys().stream()
            .filter(key -> key.endsWith(">"))
            .collect(toList());
        if (operatorKeys.isEmpty()) {
            throw new ConfigException("Recurrence rule requires a 'type>' key such as 'cron>' or 'interval>': " + recurrence);
        }
        if (operatorKeys.size() > 1) {
            throw new ConfigException("Recurrence rule must have exactly one 'type>' key: " + recurrence);
        }

        String operatorKey = operatorKeys.get(0);
        String type = operatorKey.substring(0, operatorKey.length() - 1);
        SchedulerFactory factory = types.get(type);
        if (factory == null) {
            throw new ConfigException("Unknown recurrence type: " + type);
        }
        c.set("_type", type);
        c.set("_command", c.get(operatorKey, Object.class));

        return factory.newScheduler(c, getTimeZone(c));
    }

    private static ZoneId getTimeZone(Config c)
    {
        Optional<String> name = c.getOptional("timezone", String.class);
        if (!name.isPresent()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(name.get());
        }
        catch (DateTimeException ex) {
            throw new ConfigException("Unknown time zone name: " + name.get(), ex);
        }
    }
}
