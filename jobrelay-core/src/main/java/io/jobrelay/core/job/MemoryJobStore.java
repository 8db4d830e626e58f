package io.jobrelay.core.job;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.function.UnaryOperator;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Striped;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;

import static java.util.stream.Collectors.toList;

/**
 * In-process job store. Rows are immutable {@link StoredJob} values replaced
 * under a per-job lock, so readers never block.
 */
public class MemoryJobStore
        implements JobStore
{
    static final int DEFAULT_RUN_HISTORY_LIMIT = 20;

    private final ConcurrentMap<Long, StoredJob> jobs = new ConcurrentHashMap<>();
    private final Map<Long, Deque<JobRun>> runs = new ConcurrentHashMap<>();
    private final Map<Long, Deque<TriggerEvent>> triggerEvents = new ConcurrentHashMap<>();
    private final Striped<Lock> jobLocks = Striped.lock(64);
    private final Object createLock = new Object();
    private final AtomicLong sequence = new AtomicLong(0);
    private final int historyLimit;

    @Inject
    public MemoryJobStore(Config systemConfig)
    {
        this(systemConfig.get("job.run_history_limit", int.class, DEFAULT_RUN_HISTORY_LIMIT));
    }

    @VisibleForTesting
    public MemoryJobStore(int historyLimit)
    {
        this.historyLimit = historyLimit;
    }

    @Override
    public StoredJob createJob(Job job, Instant now)
        throws ResourceConflictException
    {
        synchronized (createLock) {
            checkNameAvailable(job.getOwnerId(), job.getName(), Optional.absent());
            long id = sequence.incrementAndGet();
            StoredJob stored = ImmutableStoredJob.builder()
                .id(id)
                .name(job.getName())
                .ownerId(job.getOwnerId())
                .scriptRef(job.getScriptRef())
                .enabled(job.getEnabled())
                .dueTime(job.getDueTime())
                .recurrence(job.getRecurrence())
                .watchedPath(job.getWatchedPath())
                .webhookSecret(job.getWebhookSecret())
                .notifyOnSuccess(job.getNotifyOnSuccess())
                .notifyOnFailure(job.getNotifyOnFailure())
                .createdAt(now)
                .updatedAt(now)
                .build();
            jobs.put(id, stored);
            return stored;
        }
    }

    private void checkNameAvailable(String ownerId, String name, Optional<Long> self)
        throws ResourceConflictException
    {
        for (StoredJob other : jobs.values()) {
            if (other.getOwnerId().equals(ownerId) && other.getName().equals(name)
                    && !(self.isPresent() && self.get() == other.getId())) {
                throw new ResourceConflictException("Job named '" + name + "' already exists: id=" + other.getId());
            }
        }
    }

    @Override
    public StoredJob getJobById(long jobId)
        throws ResourceNotFoundException
    {
        StoredJob job = jobs.get(jobId);
        if (job == null) {
            throw new ResourceNotFoundException("Job id=" + jobId + " does not exist");
        }
        return job;
    }

    @Override
    public List<StoredJob> getJobs(int pageSize, Optional<Long> lastId)
    {
        long after = lastId.or(0L);
        return jobs.values().stream()
            .filter(job -> job.getId() > after)
            .sorted(Comparator.comparingLong(StoredJob::getId))
            .limit(pageSize)
            .collect(toList());
    }

    @Override
    public List<StoredJob> getJobsByOwner(String ownerId)
    {
        return jobs.values().stream()
            .filter(job -> job.getOwnerId().equals(ownerId))
            .sorted(Comparator.comparingLong(StoredJob::getId))
            .collect(toList());
    }

    @Override
    public List<StoredJob> getDueJobs(Instant currentTime, int limit)
    {
        return jobs.values().stream()
            .filter(job -> job.getEnabled() && job.getDueTime().isPresent())
            .filter(job -> !job.getDueTime().get().isAfter(currentTime))
            .sorted(Comparator.comparing((StoredJob job) -> job.getDueTime().get())
                    .thenComparingLong(StoredJob::getId))
            .limit(limit)
            .collect(toList());
    }

    @Override
    public List<StoredJob> getWatchedJobs()
    {
        return jobs.values().stream()
            .filter(job -> job.getEnabled() && job.getWatchedPath().isPresent())
            .sorted(Comparator.comparingLong(StoredJob::getId))
            .collect(toList());
    }

    @Override
    public List<StoredJob> getParents(long jobId)
    {
        return jobs.values().stream()
            .filter(job -> job.getDependents().contains(jobId))
            .sorted(Comparator.comparingLong(StoredJob::getId))
            .collect(toList());
    }

    @Override
    public <T, E extends Exception> T updateJobById(long jobId, JobUpdateAction<T, E> func)
        throws ResourceNotFoundException, E
    {
        Lock lock = jobLocks.get(jobId);
        lock.lock();
        try {
            StoredJob job = getJobById(jobId);
            return func.call(new MemoryJobControlStore(), job);
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public boolean compareAndSetLease(long jobId, Optional<ExecutionLease> expected, Optional<ExecutionLease> update)
        throws ResourceNotFoundException
    {
        Lock lock = jobLocks.get(jobId);
        lock.lock();
        try {
            StoredJob job = getJobById(jobId);
            if (!job.getExecutionLease().equals(expected)) {
                return false;
            }
            jobs.put(jobId, ImmutableStoredJob.builder()
                    .from(job)
                    .executionLease(update)
                    .build());
            return true;
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteJobById(long jobId)
        throws ResourceNotFoundException
    {
        Lock lock = jobLocks.get(jobId);
        lock.lock();
        try {
            if (jobs.remove(jobId) == null) {
                throw new ResourceNotFoundException("Job id=" + jobId + " does not exist");
            }
            runs.remove(jobId);
            triggerEvents.remove(jobId);
        }
        finally {
            lock.unlock();
        }
    }

    @Override
    public void putRun(JobRun run)
    {
        Deque<JobRun> history = runs.computeIfAbsent(run.getJobId(), key -> new ArrayDeque<>());
        synchronized (history) {
            history.removeIf(existing -> existing.getRunId().equals(run.getRunId()));
            history.addFirst(run);
            while (history.size() > historyLimit) {
                history.removeLast();
            }
        }
    }

    @Override
    public List<JobRun> getRuns(long jobId, int limit)
    {
        Deque<JobRun> history = runs.get(jobId);
        if (history == null) {
            return ImmutableList.of();
        }
        synchronized (history) {
            return history.stream()
                .sorted(Comparator.comparing(JobRun::getStartedAt).reversed())
                .limit(limit)
                .collect(toList());
        }
    }

    @Override
    public void putTriggerEvent(TriggerEvent event)
    {
        Deque<TriggerEvent> events = triggerEvents.computeIfAbsent(event.getJobId(), key -> new ArrayDeque<>());
        synchronized (events) {
            events.addFirst(event);
            while (events.size() > historyLimit) {
                events.removeLast();
            }
        }
    }

    @Override
    public List<TriggerEvent> getTriggerEvents(long jobId, int limit)
    {
        Deque<TriggerEvent> events = triggerEvents.get(jobId);
        if (events == null) {
            return ImmutableList.of();
        }
        synchronized (events) {
            return events.stream().limit(limit).collect(toList());
        }
    }

    // callers hold the job's lock
    private class MemoryJobControlStore
            implements JobControlStore
    {
        @Override
        public StoredJob getJobById(long jobId)
            throws ResourceNotFoundException
        {
            return MemoryJobStore.this.getJobById(jobId);
        }

        private void modify(long jobId, UnaryOperator<ImmutableStoredJob.Builder> change)
            throws ResourceNotFoundException
        {
            StoredJob job = getJobById(jobId);
            jobs.put(jobId, change.apply(ImmutableStoredJob.builder().from(job))
                    .updatedAt(Instant.now())
                    .build());
        }

        @Override
        public void updateDefinition(long jobId, Job definition)
            throws ResourceNotFoundException, ResourceConflictException
        {
            synchronized (createLock) {
                checkNameAvailable(definition.getOwnerId(), definition.getName(), Optional.of(jobId));
                modify(jobId, builder -> builder
                        .name(definition.getName())
                        .ownerId(definition.getOwnerId())
                        .scriptRef(definition.getScriptRef())
                        .enabled(definition.getEnabled())
                        .dueTime(definition.getDueTime())
                        .recurrence(definition.getRecurrence())
                        .watchedPath(definition.getWatchedPath())
                        .webhookSecret(definition.getWebhookSecret())
                        .notifyOnSuccess(definition.getNotifyOnSuccess())
                        .notifyOnFailure(definition.getNotifyOnFailure()));
            }
        }

        @Override
        public void updateEnabled(long jobId, boolean enabled)
            throws ResourceNotFoundException
        {
            modify(jobId, builder -> builder.enabled(enabled));
        }

        @Override
        public void updateDueTime(long jobId, Optional<Instant> dueTime)
            throws ResourceNotFoundException
        {
            modify(jobId, builder -> builder.dueTime(dueTime));
        }

        @Override
        public boolean advanceLastSeenMtime(long jobId, Instant mtime)
            throws ResourceNotFoundException
        {
            Optional<Instant> current = getJobById(jobId).getLastSeenMtime();
            if (current.isPresent() && !mtime.isAfter(current.get())) {
                return false;
            }
            modify(jobId, builder -> builder.lastSeenMtime(mtime));
            return true;
        }

        @Override
        public void updateLastRunAt(long jobId, Instant startedAt)
            throws ResourceNotFoundException
        {
            modify(jobId, builder -> builder.lastRunAt(startedAt));
        }

        @Override
        public void updateLastRunFinishedAt(long jobId, Instant finishedAt)
            throws ResourceNotFoundException
        {
            modify(jobId, builder -> builder.lastRunFinishedAt(finishedAt));
        }

        @Override
        public void addDependent(long jobId, long dependentId)
            throws ResourceNotFoundException
        {
            modify(jobId, builder -> builder.addDependents(dependentId));
        }

        @Override
        public void removeDependent(long jobId, long dependentId)
            throws ResourceNotFoundException
        {
            StoredJob job = getJobById(jobId);
            modify(jobId, builder -> builder.dependents(job.getDependents().stream()
                        .filter(id -> id != dependentId)
                        .collect(toList())));
        }
    }
}
