package io.jobrelay.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;
import com.google.common.base.Optional;
import it.sauronsoftware.cron4j.Predictor;
import it.sauronsoftware.cron4j.SchedulingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Occurrences matching a cron pattern, shifted by delaySeconds.
 * <p>
 * Times returned by this scheduler are run times, that is pattern match + delay.
 */
public class CronScheduler
        extends BaseScheduler
{
    private static final Logger logger = LoggerFactory.getLogger(CronScheduler.class);

    private final String cronPattern;
    private final SchedulingPattern pattern;
    private final long delaySeconds;

    CronScheduler(String cronPattern, ZoneId timeZone, long delaySeconds, Optional<Instant> start, Optional<Instant> end)
    {
        super(timeZone, start, end);
        this.cronPattern = cronPattern;
        this.pattern = new SchedulingPattern(cronPattern) {
            // cron4j's match(long) uses the JVM default time zone
            @Override
            public boolean match(long millis)
            {
                return match(TimeZone.getTimeZone(timeZone), millis);
            }
        };
        this.delaySeconds = delaySeconds;
    }

    @Override
    public Instant getFirstScheduleTime(Instant currentTime)
    {
        // truncate to seconds
        Instant truncated = Instant.ofEpochSecond(currentTime.getEpochSecond());
        if (truncated.equals(currentTime)) {
            // Predictor excludes the given time from nextMatchingTime()
            truncated = truncated.minusSeconds(1);
        }
        return nextScheduleTime(truncated);
    }

    @Override
    public Instant nextScheduleTime(Instant lastScheduleTime)
    {
        Instant next = next(lastScheduleTime.minusSeconds(delaySeconds)).plusSeconds(delaySeconds);
        if (start.isPresent() && start.get().isAfter(next)) {
            logger.debug("Next run time {} is before the start {}. Recalculating from the start", next, start.get());
            next = next(start.get().minusSeconds(delaySeconds + 1)).plusSeconds(delaySeconds);
        }
        return next;
    }

    private Instant next(Instant time)
    {
        Predictor predictor = new Predictor(pattern, Date.from(time));
        predictor.setTimeZone(TimeZone.getTimeZone(timeZone));
        return Instant.ofEpochMilli(predictor.nextMatchingTime());
    }

    @Override
    public String toString()
    {
        return "CronScheduler{" + cronPattern + ", delay=" + delaySeconds + "s, " + timeZone + "}";
    }
}
