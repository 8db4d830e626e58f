package io.jobrelay.core.schedule;

import java.time.Duration;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.jobrelay.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduleConfig.class)
@JsonDeserialize(as = ImmutableScheduleConfig.class)
public interface ScheduleConfig
{
    Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
    Duration DEFAULT_SELF_TOUCH_GRACE = Duration.ofSeconds(5);
    int DEFAULT_DUE_JOB_LIMIT = 100;

    boolean getEnabled();

    Duration getPollInterval();

    int getDueJobLimit();

    MissedRunPolicy getMissedRunPolicy();

    Duration getSelfTouchGrace();

    static ImmutableScheduleConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleConfig.builder()
            .enabled(true)
            .pollInterval(DEFAULT_POLL_INTERVAL)
            .dueJobLimit(DEFAULT_DUE_JOB_LIMIT)
            .missedRunPolicy(MissedRunPolicy.COLLAPSE)
            .selfTouchGrace(DEFAULT_SELF_TOUCH_GRACE);
    }

    static ScheduleConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .enabled(config.get("poller.enabled", boolean.class, true))
            .pollInterval(config.getDuration("poller.interval", DEFAULT_POLL_INTERVAL))
            .dueJobLimit(config.get("poller.due_job_limit", int.class, DEFAULT_DUE_JOB_LIMIT))
            .missedRunPolicy(MissedRunPolicy.fromString(config.get("schedule.missed_run_policy", String.class, "collapse")))
            .selfTouchGrace(config.getDuration("file_watch.self_touch_grace", DEFAULT_SELF_TOUCH_GRACE))
            .build();
    }
}
