package io.jobrelay.core.watch;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import com.google.inject.Inject;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.schedule.ScheduleConfig;

/**
 * Decides whether a change of a job's watched file was made by the job itself.
 * <p>
 * A change counts as the job's own write when the job holds an active lease,
 * or when the modification time falls between the start of its latest run and
 * the end of that run plus a grace period.
 */
public class SelfTouchPolicy
{
    private final Duration grace;

    @Inject
    public SelfTouchPolicy(ScheduleConfig config)
    {
        this(config.getSelfTouchGrace());
    }

    public SelfTouchPolicy(Duration grace)
    {
        this.grace = grace;
    }

    public boolean isSelfTouch(StoredJob job, Instant mtime, Instant now)
    {
        if (job.isRunning(now)) {
            return true;
        }
        if (!job.getLastRunAt().isPresent()) {
            return false;
        }
        Instant runStart = job.getLastRunAt().get();
        // some file systems keep mtime in whole seconds
        if (mtime.isBefore(runStart.truncatedTo(ChronoUnit.SECONDS))) {
            return false;
        }
        if (!job.getLastRunFinishedAt().isPresent() || job.getLastRunFinishedAt().get().isBefore(runStart)) {
            // started but never recorded a finish, e.g. the lease expired mid-run
            return false;
        }
        Instant windowEnd = job.getLastRunFinishedAt().get().plus(grace);
        return !mtime.isAfter(windowEnd);
    }
}
