package io.jobrelay.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.jobrelay.spi.Scheduler;

public abstract class BaseScheduler
        implements Scheduler
{
    protected final ZoneId timeZone;
    protected final Optional<Instant> start;
    protected final Optional<Instant> end;

    BaseScheduler(ZoneId timeZone, Optional<Instant> start, Optional<Instant> end)
    {
        this.timeZone = timeZone;
        this.start = start;
        this.end = end;
    }

    @Override
    public ZoneId getTimeZone()
    {
        return timeZone;
    }

    @Override
    public Optional<Instant> getStartDate()
    {
        return start;
    }

    @Override
    public Optional<Instant> getEndDate()
    {
        return end;
    }
}
