package io.jobrelay.core.execution;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.jobrelay.core.BackgroundExecutor;
import io.jobrelay.core.chain.ChainResolver;
import io.jobrelay.core.job.ExecutionLease;
import io.jobrelay.core.job.ImmutableJobRun;
import io.jobrelay.core.job.JobControl;
import io.jobrelay.core.job.JobRun;
import io.jobrelay.core.job.JobRunStatus;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.core.schedule.RecurrenceScheduler;
import io.jobrelay.spi.Notification;
import io.jobrelay.spi.NotificationException;
import io.jobrelay.spi.Notifier;
import io.jobrelay.spi.ScriptExecutionException;
import io.jobrelay.spi.ScriptRequest;
import io.jobrelay.spi.ScriptResult;
import io.jobrelay.spi.ScriptRunner;
import io.jobrelay.spi.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only way to run a job. Every trigger source calls {@link #execute(long, Trigger)}.
 * <p>
 * At most one run per job is active at a time. This is enforced by an
 * {@link ExecutionLease} stored in the job record, so it also holds when
 * triggers arrive through different processes. Runs of different jobs share
 * a bounded worker pool; when both the workers and the queue are full a
 * trigger is rejected with a retryable result.
 */
public class ExecutionCoordinator
        implements BackgroundExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final JobStore store;
    private final ScriptRunner scriptRunner;
    private final Notifier notifier;
    private final RecurrenceScheduler recurrenceScheduler;
    private final ChainResolver chainResolver;
    private final ExecutionConfig config;
    private final ExecutorService executor;

    @Inject
    public ExecutionCoordinator(
            JobStore store,
            ScriptRunner scriptRunner,
            Notifier notifier,
            RecurrenceScheduler recurrenceScheduler,
            ChainResolver chainResolver,
            ExecutionConfig config)
    {
        this(store, scriptRunner, notifier, recurrenceScheduler, chainResolver, config, newWorkerPool(config));
    }

    @VisibleForTesting
    public ExecutionCoordinator(
            JobStore store,
            ScriptRunner scriptRunner,
            Notifier notifier,
            RecurrenceScheduler recurrenceScheduler,
            ChainResolver chainResolver,
            ExecutionConfig config,
            ExecutorService executor)
    {
        this.store = store;
        this.scriptRunner = scriptRunner;
        this.notifier = notifier;
        this.recurrenceScheduler = recurrenceScheduler;
        this.chainResolver = chainResolver;
        this.config = config;
        this.executor = executor;
    }

    @VisibleForTesting
    static ThreadPoolExecutor newWorkerPool(ExecutionConfig config)
    {
        BlockingQueue<Runnable> queue;
        if (config.getQueueCapacity() == 0) {
            queue = new SynchronousQueue<>();
        }
        else {
            queue = new ArrayBlockingQueue<>(config.getQueueCapacity());
        }
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                config.getMaxConcurrent(), config.getMaxConcurrent(),
                60, TimeUnit.SECONDS,
                queue,
                new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("job-executor-%d")
                    .build(),
                new ThreadPoolExecutor.AbortPolicy());
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    /**
     * Starts a run of the job unless it is disabled, already running, or the
     * worker pool is saturated. A scheduler trigger whose dueTime is no longer
     * the job's dueTime is skipped. Returns without waiting for the script.
     *
     * @throws ResourceNotFoundException if the job does not exist
     * @throws io.jobrelay.core.repository.StoreUnavailableException if the job store can't be read
     */
    public TriggerResult execute(long jobId, Trigger trigger)
        throws ResourceNotFoundException
    {
        StoredJob job = store.getJobById(jobId);

        if (!job.getEnabled()) {
            logger.debug("Job id={} is disabled. Ignoring {} trigger.", jobId, trigger.getSource());
            return TriggerResult.disabled();
        }

        Instant now = Instant.now();
        Optional<ExecutionLease> current = job.getExecutionLease();
        if (current.isPresent() && current.get().isActive(now)) {
            logger.info("Job id={} is already running (run {}). Ignoring {} trigger.",
                    jobId, current.get().getHolderId(), trigger.getSource());
            return TriggerResult.alreadyRunning(current.get().getHolderId());
        }

        ExecutionLease lease = ExecutionLease.of(UUID.randomUUID().toString(), now.plus(config.getLeaseDuration()));
        if (!store.compareAndSetLease(jobId, current, Optional.of(lease))) {
            // lost the race against a concurrent trigger
            StoredJob latest = store.getJobById(jobId);
            String holder = latest.getExecutionLease().transform(ExecutionLease::getHolderId).or("unknown");
            logger.info("Job id={} was started by another trigger (run {}). Ignoring {} trigger.",
                    jobId, holder, trigger.getSource());
            return TriggerResult.alreadyRunning(holder);
        }
        if (current.isPresent()) {
            logger.warn("Lease of run {} on job id={} expired at {}. Taking it over.",
                    current.get().getHolderId(), jobId, current.get().getExpiresAt());
        }

        if (trigger.getSource() == TriggerSource.SCHEDULER) {
            // dueTime moves only after a scheduled run ends. a poll that read
            // the job while the previous run was in flight still holds the old value.
            Optional<Instant> dueTime = store.getJobById(jobId).getDueTime();
            if (!dueTime.equals(trigger.getDueTime())) {
                releaseLease(jobId, lease);
                logger.debug("Occurrence {} of job id={} was already handled. Next due time is {}.",
                        trigger.getDueTime().get(), jobId, dueTime.orNull());
                return TriggerResult.skipped();
            }
        }

        try {
            executor.execute(() -> run(job, trigger, lease));
        }
        catch (RejectedExecutionException ex) {
            releaseLease(jobId, lease);
            logger.warn("Rejected {} trigger of job id={}: all {} workers and {} queue slots are in use",
                    trigger.getSource(), jobId, config.getMaxConcurrent(), config.getQueueCapacity());
            return TriggerResult.rejected();
        }

        logger.info("Accepted {} trigger of job id={} as run {}", trigger.getSource(), jobId, lease.getHolderId());
        return TriggerResult.accepted(lease.getHolderId());
    }

    private void run(StoredJob job, Trigger trigger, ExecutionLease lease)
    {
        long jobId = job.getId();
        String runId = lease.getHolderId();
        boolean succeeded = false;
        try {
            Instant startedAt = Instant.now();
            JobRun run = JobRun.started(runId, jobId, trigger.getSource(), startedAt);
            store.putRun(run);
            updateJob(jobId, control -> control.markRunStarted(startedAt));

            ScriptResult result = invokeScript(job, trigger, runId);
            succeeded = result.isSuccess();

            Instant finishedAt = Instant.now();
            store.putRun(ImmutableJobRun.builder()
                    .from(run)
                    .status(succeeded ? JobRunStatus.SUCCESS : JobRunStatus.FAILED)
                    .finishedAt(finishedAt)
                    .output(result.getOutput())
                    .error(result.getError())
                    .build());
            updateJob(jobId, control -> control.markRunFinished(finishedAt));

            notifyCompletion(job, trigger, runId, result, finishedAt);

            if (trigger.getSource() == TriggerSource.SCHEDULER) {
                recurrenceScheduler.advanceAfterScheduledRun(jobId, trigger.getDueTime().get(), finishedAt);
            }
        }
        catch (ResourceNotFoundException ex) {
            logger.warn("Job id={} was deleted during run {}", jobId, runId);
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Run {} of job id={} is marked completed.", runId, jobId, t);
        }
        finally {
            try {
                chainResolver.onComplete(jobId, succeeded);
            }
            catch (Throwable t) {
                logger.error("Failed to propagate completion of job id={}", jobId, t);
            }
            releaseLease(jobId, lease);
        }
    }

    private ScriptResult invokeScript(StoredJob job, Trigger trigger, String runId)
    {
        ScriptRequest request = ScriptRequest.builder()
            .jobId(job.getId())
            .jobName(job.getName())
            .ownerId(job.getOwnerId())
            .scriptRef(job.getScriptRef())
            .runId(runId)
            .source(trigger.getSource())
            .callerId(trigger.getCallerId())
            .build();

        try (ExecutionContext context = ExecutionContext.open(job.getOwnerId(), job.getId(), runId)) {
            logger.info("Running job id={} '{}' for {}", job.getId(), job.getName(), job.getOwnerId());
            ScriptResult result = scriptRunner.run(request);
            if (result.isSuccess()) {
                logger.info("Run {} of job id={} succeeded", runId, job.getId());
            }
            else {
                logger.warn("Run {} of job id={} failed: {}", runId, job.getId(), result.getError().or("unknown error"));
            }
            return result;
        }
        catch (ScriptExecutionException ex) {
            logger.warn("Run {} of job id={} could not be executed", runId, job.getId(), ex);
            return ScriptResult.failed(ex.getMessage(), Optional.absent());
        }
        catch (RuntimeException ex) {
            logger.error("Script runner failed unexpectedly on run {} of job id={}", runId, job.getId(), ex);
            return ScriptResult.failed("Unexpected error: " + ex, Optional.absent());
        }
    }

    private void notifyCompletion(StoredJob job, Trigger trigger, String runId, ScriptResult result, Instant finishedAt)
    {
        boolean wanted = result.isSuccess() ? job.getNotifyOnSuccess() : job.getNotifyOnFailure();
        if (!wanted) {
            return;
        }
        String message;
        if (result.isSuccess()) {
            message = String.format("Job '%s' completed", job.getName());
        }
        else {
            message = String.format("Job '%s' failed: %s", job.getName(), result.getError().or("unknown error"));
        }
        Notification notification = Notification.builder(finishedAt, message)
            .jobId(job.getId())
            .jobName(job.getName())
            .ownerId(job.getOwnerId())
            .runId(runId)
            .success(result.isSuccess())
            .source(trigger.getSource())
            .output(result.getOutput())
            .error(result.getError())
            .build();
        try {
            notifier.sendNotification(notification);
        }
        catch (NotificationException | RuntimeException ex) {
            logger.warn("Failed to send notification of run {} of job id={}", runId, job.getId(), ex);
        }
    }

    private interface ControlAction
    {
        void apply(JobControl control)
            throws ResourceNotFoundException;
    }

    private void updateJob(long jobId, ControlAction action)
        throws ResourceNotFoundException
    {
        store.updateJobById(jobId, (controlStore, storedJob) -> {
            action.apply(new JobControl(controlStore, storedJob));
            return null;
        });
    }

    private void releaseLease(long jobId, ExecutionLease lease)
    {
        try {
            if (!store.compareAndSetLease(jobId, Optional.of(lease), Optional.absent())) {
                logger.warn("Lease of run {} on job id={} was taken over before release", lease.getHolderId(), jobId);
            }
        }
        catch (ResourceNotFoundException ex) {
            logger.debug("Job id={} was deleted before its lease was released", jobId);
        }
        catch (RuntimeException ex) {
            logger.error("Failed to release lease of run {} on job id={}. It expires at {}.",
                    lease.getHolderId(), jobId, lease.getExpiresAt(), ex);
        }
    }

    @Override
    public void eagerShutdown()
        throws InterruptedException
    {
        executor.shutdown();
        if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
            logger.warn("Job runs did not finish within 10 seconds of shutdown. They are left running.");
        }
    }
}
