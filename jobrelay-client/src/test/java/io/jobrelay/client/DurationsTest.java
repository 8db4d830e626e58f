package io.jobrelay.client;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DurationsTest
{
    @Test
    public void parse()
    {
        assertThat(Durations.parseDuration("10m"), is(Duration.ofMinutes(10)));
        assertThat(Durations.parseDuration("1h 30m"), is(Duration.ofMinutes(90)));
        assertThat(Durations.parseDuration("2d"), is(Duration.ofDays(2)));
        assertThat(Durations.parseDuration(" 45S "), is(Duration.ofSeconds(45)));
    }

    @Test
    public void format()
    {
        assertThat(Durations.formatDuration(Duration.ofSeconds(3725)), is("1h 2m 5s"));
    }

    @Test(expected = DateTimeParseException.class)
    public void rejectsEmptyExpression()
    {
        Durations.parseDuration("  ");
    }

    @Test(expected = DateTimeParseException.class)
    public void rejectsUnknownUnit()
    {
        Durations.parseDuration("3 weeks");
    }

    @Test(expected = DateTimeParseException.class)
    public void rejectsUnitsOutOfOrder()
    {
        Durations.parseDuration("30m 1h");
    }
}
