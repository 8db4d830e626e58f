package io.jobrelay.spi;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;

public interface Scheduler
{
    ZoneId getTimeZone();

    Optional<Instant> getStartDate();

    // no occurrence is scheduled at or after this time.
    Optional<Instant> getEndDate();

    // first schedule time that is same or after currentTime.
    Instant getFirstScheduleTime(Instant currentTime);

    // next schedule time. returned time is strictly after lastScheduleTime.
    Instant nextScheduleTime(Instant lastScheduleTime);
}
