package io.jobrelay.standards.scheduler;

import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.spi.Scheduler;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class CronSchedulerTest
        extends SchedulerTestHelper
{
    @Override
    Scheduler newScheduler(Object pattern, String timeZone, Optional<String> start, Optional<String> end)
    {
        return new CronSchedulerFactory(configHelper).newScheduler(newConfig(pattern, start, end), ZoneId.of(timeZone));
    }

    @Test
    public void firstScheduleTimeUtc()
    {
        assertThat(
                newScheduler("0 10 * * *", "UTC").getFirstScheduleTime(instant("2016-02-03 09:34:12 +0000")),
                is(instant("2016-02-03 10:00:00 +0000")));
        // the current time itself matches
        assertThat(
                newScheduler("0 10 * * *", "UTC").getFirstScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-02-03 10:00:00 +0000")));
        assertThat(
                newScheduler("0 10 * * *", "UTC").getFirstScheduleTime(instant("2016-02-03 10:00:01 +0000")),
                is(instant("2016-02-04 10:00:00 +0000")));
    }

    @Test
    public void firstScheduleTimeWithSubSecondCurrentTime()
    {
        Instant currentTime = instant("2016-02-03 10:00:00 +0000").plusMillis(300);
        assertThat(
                newScheduler("0 10 * * *", "UTC").getFirstScheduleTime(currentTime),
                is(instant("2016-02-04 10:00:00 +0000")));
    }

    @Test
    public void firstScheduleTimeTz()
    {
        assertThat(
                newScheduler("0 10 * * *", "Asia/Tokyo").getFirstScheduleTime(instant("2016-02-03 09:34:12 +0900")),
                is(instant("2016-02-03 10:00:00 +0900")));
    }

    @Test
    public void nextScheduleTime()
    {
        assertThat(
                newScheduler("0 10 * * *", "UTC").nextScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-02-04 10:00:00 +0000")));
        assertThat(
                newScheduler("*/15 * * * *", "UTC").nextScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-02-03 10:15:00 +0000")));
    }

    @Test
    public void nextScheduleTimeDst()
    {
        // America/Los_Angeles begins DST at 2016-03-13 03:00:00 -0700
        assertThat(
                newScheduler("0 10 * * *", "America/Los_Angeles").nextScheduleTime(instant("2016-03-12 10:00:00 -0800")),
                is(instant("2016-03-13 10:00:00 -0700")));
    }

    @Test
    public void shortcuts()
    {
        assertThat(
                newScheduler("@daily", "UTC").nextScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-02-04 00:00:00 +0000")));
        assertThat(
                newScheduler("@hourly", "UTC").nextScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-02-03 11:00:00 +0000")));
        // 2016-02-07 is a Sunday
        assertThat(
                newScheduler("@weekly", "UTC").nextScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-02-07 00:00:00 +0000")));
        assertThat(
                newScheduler("@monthly", "UTC").nextScheduleTime(instant("2016-02-03 10:00:00 +0000")),
                is(instant("2016-03-01 00:00:00 +0000")));
    }

    @Test(expected = ConfigException.class)
    public void unknownShortcut()
    {
        newScheduler("@sometimes", "UTC");
    }

    @Test(expected = ConfigException.class)
    public void invalidPattern()
    {
        newScheduler("not a cron", "UTC");
    }

    @Test
    public void delay()
    {
        Scheduler scheduler = new CronSchedulerFactory(configHelper).newScheduler(
                newConfig("0 10 * * *", Optional.absent(), Optional.absent()).set("delay", 600),
                ZoneId.of("UTC"));
        assertThat(scheduler.getFirstScheduleTime(instant("2016-02-03 10:05:00 +0000")),
                is(instant("2016-02-03 10:10:00 +0000")));
        assertThat(scheduler.nextScheduleTime(instant("2016-02-03 10:10:00 +0000")),
                is(instant("2016-02-04 10:10:00 +0000")));
    }

    @Test
    public void startDate()
    {
        Scheduler scheduler = newScheduler("0 10 * * *", "UTC", Optional.of("2016-03-01"), Optional.absent());
        assertThat(scheduler.getStartDate(), is(Optional.of(instant("2016-03-01 00:00:00 +0000"))));
        assertThat(scheduler.getFirstScheduleTime(instant("2016-02-03 09:34:12 +0000")),
                is(instant("2016-03-01 10:00:00 +0000")));
    }

    @Test
    public void endDateIsInclusive()
    {
        Scheduler scheduler = newScheduler("0 10 * * *", "Asia/Tokyo", Optional.absent(), Optional.of("2016-02-10"));
        assertThat(scheduler.getEndDate(), is(Optional.of(instant("2016-02-11 00:00:00 +0900"))));
    }
}
