package io.jobrelay.standards.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;

/**
 * Fixed-length occurrences.
 * <p>
 * The first occurrence is aligned to a multiple of the interval counted from
 * the start date, or from the epoch when no start date is given. Every later
 * occurrence is exactly one interval after the previous one.
 */
public class IntervalScheduler
        extends BaseScheduler
{
    private final long intervalSeconds;

    IntervalScheduler(Duration interval, ZoneId timeZone, Optional<Instant> start, Optional<Instant> end)
    {
        super(timeZone, start, end);
        this.intervalSeconds = interval.getSeconds();
    }

    @Override
    public Instant getFirstScheduleTime(Instant currentTime)
    {
        long origin = start.transform(Instant::getEpochSecond).or(0L);
        long current = currentTime.getEpochSecond();
        if (currentTime.getNano() > 0) {
            current++;
        }
        if (current <= origin) {
            return Instant.ofEpochSecond(origin);
        }
        long steps = (current - origin + intervalSeconds - 1) / intervalSeconds;
        return Instant.ofEpochSecond(origin + steps * intervalSeconds);
    }

    @Override
    public Instant nextScheduleTime(Instant lastScheduleTime)
    {
        Instant next = lastScheduleTime.plusSeconds(intervalSeconds);
        if (start.isPresent() && next.isBefore(start.get())) {
            return start.get();
        }
        return next;
    }

    @Override
    public String toString()
    {
        return "IntervalScheduler{" + intervalSeconds + "s, start=" + start.orNull() + "}";
    }
}
