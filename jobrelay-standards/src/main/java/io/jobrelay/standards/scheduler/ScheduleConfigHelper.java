package io.jobrelay.standards.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import com.google.common.base.Optional;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;

/**
 * Reads the optional start and end dates of a recurrence rule.
 */
public class ScheduleConfigHelper
{
    // strict mode requires 'uuuu' instead of 'yyyy'
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter
        .ofPattern("uuuu-MM-dd", Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);

    private static LocalDate getLocalDate(String ymd)
    {
        return LocalDate.from(DATE_FORMAT.parse(ymd));
    }

    // beginning of the day
    public Optional<Instant> getDateTimeStart(Config config, String key, ZoneId zoneId)
        throws ConfigException
    {
        Optional<String> start = config.getOptional(key, String.class);
        try {
            return start.transform(v -> getLocalDate(v).atStartOfDay(zoneId).toInstant());
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException(String.format("Invalid %s: %s (%s)", key, start.or(""), ex.getMessage()));
        }
    }

    // the end date is inclusive, so this is the beginning of the next day
    public Optional<Instant> getDateTimeEnd(Config config, String key, ZoneId zoneId)
        throws ConfigException
    {
        Optional<String> end = config.getOptional(key, String.class);
        try {
            return end.transform(v -> getLocalDate(v).plusDays(1).atStartOfDay(zoneId).toInstant());
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException(String.format("Invalid %s: %s (%s)", key, end.or(""), ex.getMessage()));
        }
    }

    public void validateStartEnd(Optional<Instant> start, Optional<Instant> end)
        throws ConfigException
    {
        if (start.isPresent() && end.isPresent()) {
            if (!start.get().isBefore(end.get())) {
                throw new ConfigException("The schedule of end is earlier than start");
            }
        }
    }

    public <S extends BaseScheduler> S checkRange(S scheduler)
        throws ConfigException
    {
        validateStartEnd(scheduler.getStartDate(), scheduler.getEndDate());
        return scheduler;
    }
}
