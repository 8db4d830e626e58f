package io.jobrelay.core.schedule;

import java.time.Instant;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.core.job.JobControl;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.spi.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes due times of recurring jobs.
 * <p>
 * The next due time is anchored to the previous due time, never to the time
 * the run actually started, so late runs do not shift later occurrences.
 */
public class RecurrenceScheduler
{
    private static final Logger logger = LoggerFactory.getLogger(RecurrenceScheduler.class);

    // upper bound of occurrences stepped through when collapsing missed ones
    private static final int MAX_COLLAPSE_STEPS = 10_000;

    private final SchedulerManager srm;
    private final JobStore store;
    private final MissedRunPolicy missedRunPolicy;

    @Inject
    public RecurrenceScheduler(SchedulerManager srm, JobStore store, ScheduleConfig config)
    {
        this(srm, store, config.getMissedRunPolicy());
    }

    @VisibleForTesting
    RecurrenceScheduler(SchedulerManager srm, JobStore store, MissedRunPolicy missedRunPolicy)
    {
        this.srm = srm;
        this.store = store;
        this.missedRunPolicy = missedRunPolicy;
    }

    public MissedRunPolicy getMissedRunPolicy()
    {
        return missedRunPolicy;
    }

    /**
     * Validates the rule and returns the first occurrence at or after now.
     * Absent if the rule already ended.
     */
    public Optional<Instant> firstDueTime(Config recurrence, Instant now)
    {
        Scheduler scheduler = srm.getScheduler(recurrence);
        return withinEndDate(scheduler, scheduler.getFirstScheduleTime(now));
    }

    public Optional<Instant> nextDueTime(Config recurrence, Instant previousDueTime, Instant now)
    {
        return nextDueTime(srm.getScheduler(recurrence), previousDueTime, now);
    }

    @VisibleForTesting
    Optional<Instant> nextDueTime(Scheduler scheduler, Instant previousDueTime, Instant now)
    {
        Instant next = strictlyNext(scheduler, previousDueTime);

        if (missedRunPolicy == MissedRunPolicy.COLLAPSE && !next.isAfter(now)) {
            next = collapse(scheduler, next, now);
        }

        return withinEndDate(scheduler, next);
    }

    private Instant collapse(Scheduler scheduler, Instant missed, Instant now)
    {
        Instant next = missed;
        int skipped = 0;
        while (!next.isAfter(now)) {
            if (skipped >= MAX_COLLAPSE_STEPS) {
                // too many missed occurrences to step through. re-align to now
                // which gives up the anchor only in this case.
                logger.warn("Skipped more than {} missed occurrences since {}. Aligning to {}", MAX_COLLAPSE_STEPS, missed, now);
                next = scheduler.getFirstScheduleTime(now);
                if (!next.isAfter(now)) {
                    next = strictlyNext(scheduler, next);
                }
                return next;
            }
            next = strictlyNext(scheduler, next);
            skipped++;
        }
        if (skipped > 0) {
            logger.info("Collapsed {} missed occurrences since {} into a single run at {}", skipped, missed, next);
        }
        return next;
    }

    private static Instant strictlyNext(Scheduler scheduler, Instant time)
    {
        Instant next = scheduler.nextScheduleTime(time);
        if (!next.isAfter(time)) {
            throw new IllegalStateException(String.format(
                        "Recurrence rule did not move forward: %s returned %s for %s",
                        scheduler, next, time));
        }
        return next;
    }

    private static Optional<Instant> withinEndDate(Scheduler scheduler, Instant next)
    {
        if (scheduler.getEndDate().isPresent() && !next.isBefore(scheduler.getEndDate().get())) {
            logger.debug("Next occurrence {} is after the end date {}", next, scheduler.getEndDate().get());
            return Optional.absent();
        }
        return Optional.of(next);
    }

    /**
     * Moves a job's dueTime forward after a run fired by the poller.
     * <p>
     * Jobs without a recurrence rule are one-shot: their dueTime is cleared.
     * If the dueTime was changed while the job ran, the new value is kept.
     *
     * @return the due time stored after this call
     */
    public Optional<Instant> advanceAfterScheduledRun(long jobId, Instant triggeringDueTime, Instant now)
        throws ResourceNotFoundException
    {
        return store.updateJobById(jobId, (controlStore, storedJob) -> {
            JobControl control = new JobControl(controlStore, storedJob);

            if (!storedJob.getDueTime().equals(Optional.of(triggeringDueTime))) {
                logger.debug("Due time of job id={} changed from {} to {} during the run. Keeping it.",
                        jobId, triggeringDueTime, storedJob.getDueTime().orNull());
                return storedJob.getDueTime();
            }

            Optional<Instant> next;
            if (storedJob.getRecurrence().isPresent()) {
                next = nextDueTime(storedJob.getRecurrence().get(), triggeringDueTime, now);
            }
            else {
                next = Optional.absent();
            }
            control.updateDueTime(next);
            logger.debug("Next due time of job id={}: {}", jobId, next.orNull());
            return next;
        });
    }
}
