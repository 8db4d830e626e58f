package io.jobrelay.spi;

import java.time.ZoneId;
import io.jobrelay.client.config.Config;

public interface SchedulerFactory
{
    // matches the "xxx>" key of a recurrence rule without the trailing '>'
    String getType();

    // config has the "xxx>" value under "_command"
    Scheduler newScheduler(Config config, ZoneId timeZone);
}
