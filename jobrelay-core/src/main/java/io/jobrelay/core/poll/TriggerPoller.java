package io.jobrelay.core.poll;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.jobrelay.core.BackgroundExecutor;
import io.jobrelay.core.execution.ExecutionCoordinator;
import io.jobrelay.core.execution.Trigger;
import io.jobrelay.core.execution.TriggerResult;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.core.schedule.ScheduleConfig;
import io.jobrelay.core.watch.FileWatchState;
import io.jobrelay.core.watch.SelfTouchPolicy;
import io.jobrelay.core.watch.WatchedFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single fixed-delay loop that fires due jobs and jobs whose watched file changed.
 * <p>
 * The loop only detects and forwards. Scripts run on the coordinator's workers,
 * so a slow job never delays the next tick.
 */
public class TriggerPoller
        implements BackgroundExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(TriggerPoller.class);

    private final JobStore store;
    private final FileWatchState fileWatchState;
    private final SelfTouchPolicy selfTouchPolicy;
    private final ExecutionCoordinator coordinator;
    private final ScheduleConfig config;
    private ScheduledExecutorService executor;

    @Inject
    public TriggerPoller(
            JobStore store,
            FileWatchState fileWatchState,
            SelfTouchPolicy selfTouchPolicy,
            ExecutionCoordinator coordinator,
            ScheduleConfig config)
    {
        this.store = store;
        this.fileWatchState = fileWatchState;
        this.selfTouchPolicy = selfTouchPolicy;
        this.coordinator = coordinator;
        this.config = config;
    }

    @VisibleForTesting
    public synchronized boolean isStarted()
    {
        return executor != null;
    }

    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.info("Trigger poller is disabled by poller.enabled");
            return;
        }
        if (executor == null) {
            executor = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("trigger-poller-%d")
                    .build()
                    );
            long intervalMillis = config.getPollInterval().toMillis();
            executor.scheduleWithFixedDelay(() -> poll(),
                    intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            logger.info("Started trigger poller with interval {}", config.getPollInterval());
        }
    }

    public synchronized void shutdown()
        throws InterruptedException
    {
        if (executor != null) {
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Trigger poller did not stop within 30 seconds");
            }
            executor = null;
        }
    }

    @Override
    public void eagerShutdown()
        throws Exception
    {
        shutdown();
    }

    private void poll()
    {
        try {
            runPollOnce(Instant.now());
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Polling will be retried.", t);
        }
    }

    /**
     * Runs one tick.
     *
     * @return number of triggers forwarded to the coordinator
     */
    @VisibleForTesting
    public int runPollOnce(Instant now)
    {
        return pollDueJobs(now) + pollWatchedFiles(now);
    }

    private int pollDueJobs(Instant now)
    {
        List<StoredJob> dueJobs;
        try {
            dueJobs = store.getDueJobs(now, config.getDueJobLimit());
        }
        catch (RuntimeException ex) {
            logger.error("Failed to read due jobs. Retrying on next tick.", ex);
            return 0;
        }

        int triggered = 0;
        for (StoredJob job : dueJobs) {
            try {
                Instant dueTime = job.getDueTime().get();
                TriggerResult result = coordinator.execute(job.getId(), Trigger.scheduler(dueTime));
                triggered++;
                switch (result.getStatus()) {
                case ACCEPTED:
                    logger.debug("Job id={} due at {} started as run {}", job.getId(), dueTime, result.getRunId().orNull());
                    break;
                case ALREADY_RUNNING:
                    logger.debug("Job id={} due at {} is still running. Retrying on next tick.", job.getId(), dueTime);
                    break;
                case REJECTED:
                    logger.info("Job id={} due at {} was rejected by the executor. Retrying on next tick.", job.getId(), dueTime);
                    break;
                case SKIPPED:
                    logger.debug("Job id={} due at {} already ran", job.getId(), dueTime);
                    break;
                default:
                    break;
                }
            }
            catch (ResourceNotFoundException ex) {
                logger.debug("Due job id={} was deleted", job.getId());
            }
            catch (RuntimeException ex) {
                logger.error("Failed to trigger due job id={}. Retrying on next tick.", job.getId(), ex);
            }
        }
        return triggered;
    }

    private int pollWatchedFiles(Instant now)
    {
        List<StoredJob> watchedJobs;
        try {
            watchedJobs = store.getWatchedJobs();
        }
        catch (RuntimeException ex) {
            logger.error("Failed to read watched jobs. Retrying on next tick.", ex);
            return 0;
        }

        int triggered = 0;
        for (StoredJob job : watchedJobs) {
            try {
                if (checkWatchedFile(job, now)) {
                    triggered++;
                }
            }
            catch (ResourceNotFoundException ex) {
                logger.debug("Watching job id={} was deleted", job.getId());
            }
            catch (RuntimeException ex) {
                logger.error("Failed to check watched file of job id={}", job.getId(), ex);
            }
        }
        return triggered;
    }

    private boolean checkWatchedFile(StoredJob job, Instant now)
        throws ResourceNotFoundException
    {
        String path = job.getWatchedPath().get();
        Optional<Instant> mtime;
        try {
            mtime = WatchedFiles.readModifiedTime(path);
        }
        catch (IOException ex) {
            logger.warn("Failed to read modification time of {} watched by job id={}", path, job.getId(), ex);
            return false;
        }
        if (!mtime.isPresent()) {
            return false;
        }

        Optional<Instant> lastSeen = fileWatchState.getLastSeenMtime(job.getId());
        if (lastSeen.isPresent() && !mtime.get().isAfter(lastSeen.get())) {
            return false;
        }

        // recorded before forwarding so that the same mtime never fires twice
        if (!fileWatchState.advance(job.getId(), mtime.get())) {
            return false;
        }

        if (selfTouchPolicy.isSelfTouch(job, mtime.get(), now)) {
            logger.debug("Ignoring change of {} at {} made by job id={} itself", path, mtime.get(), job.getId());
            return false;
        }

        TriggerResult result = coordinator.execute(job.getId(), Trigger.file(mtime.get()));
        if (result.getStatus() == TriggerResult.Status.ACCEPTED) {
            logger.info("Change of {} at {} triggered job id={}", path, mtime.get(), job.getId());
        }
        else {
            logger.warn("Change of {} at {} did not start job id={}: {}", path, mtime.get(), job.getId(), result.getStatus());
        }
        return true;
    }
}
