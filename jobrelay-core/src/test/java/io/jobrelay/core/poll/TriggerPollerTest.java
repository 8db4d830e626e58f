package io.jobrelay.core.poll;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.MoreExecutors;
import io.jobrelay.core.chain.ChainPolicy;
import io.jobrelay.core.chain.ChainResolver;
import io.jobrelay.core.execution.ExecutionConfig;
import io.jobrelay.core.execution.ExecutionCoordinator;
import io.jobrelay.core.execution.Trigger;
import io.jobrelay.core.job.JobManager;
import io.jobrelay.core.job.MemoryJobStore;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.repository.StoreUnavailableException;
import io.jobrelay.core.schedule.RecurrenceScheduler;
import io.jobrelay.core.schedule.ScheduleConfig;
import io.jobrelay.core.watch.SelfTouchPolicy;
import io.jobrelay.core.watch.StoredFileWatchState;
import io.jobrelay.spi.Notifier;
import io.jobrelay.spi.ScriptRequest;
import io.jobrelay.spi.ScriptResult;
import io.jobrelay.spi.ScriptRunner;
import io.jobrelay.spi.TriggerSource;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static io.jobrelay.core.CoreTestUtils.everySeconds;
import static io.jobrelay.core.CoreTestUtils.job;
import static io.jobrelay.core.CoreTestUtils.newSchedulerManager;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TriggerPollerTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private MemoryJobStore store;
    private ScriptRunner runner;
    private ExecutionCoordinator coordinator;
    private JobManager jobManager;
    private TriggerPoller poller;

    @Before
    public void setUp()
            throws Exception
    {
        store = spy(new MemoryJobStore(20));
        runner = mock(ScriptRunner.class);
        when(runner.run(any(ScriptRequest.class))).thenReturn(ScriptResult.succeeded(Optional.absent()));

        ScheduleConfig scheduleConfig = ScheduleConfig.defaultBuilder().build();
        RecurrenceScheduler recurrenceScheduler = new RecurrenceScheduler(newSchedulerManager(), store, scheduleConfig);
        ChainResolver chainResolver = new ChainResolver(store, () -> coordinator, ChainPolicy.ALWAYS);
        coordinator = new ExecutionCoordinator(store, runner, mock(Notifier.class), recurrenceScheduler, chainResolver,
                ExecutionConfig.defaultBuilder().build(), MoreExecutors.newDirectExecutorService());
        StoredFileWatchState fileWatchState = new StoredFileWatchState(store);
        jobManager = new JobManager(store, recurrenceScheduler, chainResolver, fileWatchState);
        poller = new TriggerPoller(store, fileWatchState, new SelfTouchPolicy(Duration.ofSeconds(5)), coordinator, scheduleConfig);
    }

    private Path newWatchedFile(String name, Instant mtime)
            throws Exception
    {
        Path path = folder.newFile(name).toPath();
        Files.setLastModifiedTime(path, FileTime.from(mtime));
        return path;
    }

    private static void touch(Path path, Instant mtime)
            throws Exception
    {
        Files.setLastModifiedTime(path, FileTime.from(mtime));
    }

    private void verifyRuns(int count)
            throws Exception
    {
        verify(runner, times(count)).run(any(ScriptRequest.class));
    }

    @Test
    public void dueRecurringJobRunsOnceAndMovesForward()
            throws Exception
    {
        Instant now = Instant.now();
        Instant due = now.minusSeconds(1);
        StoredJob job = jobManager.createJob(job("alice", "report").recurrence(everySeconds(600)).dueTime(due).build());

        assertThat(poller.runPollOnce(now), is(1));
        verifyRuns(1);

        StoredJob after = store.getJobById(job.getId());
        assertThat(after.getDueTime(), is(Optional.of(due.plusSeconds(600))));
        assertThat(after.getExecutionLease(), is(Optional.absent()));

        // nothing due until the next occurrence
        assertThat(poller.runPollOnce(now), is(0));
        verifyRuns(1);
    }

    @Test
    public void futureAndDisabledJobsAreNotRun()
            throws Exception
    {
        Instant now = Instant.now();
        jobManager.createJob(job("alice", "later").dueTime(now.plusSeconds(60)).build());
        jobManager.createJob(job("alice", "off").dueTime(now.minusSeconds(60)).enabled(false).build());

        assertThat(poller.runPollOnce(now), is(0));
        verify(runner, never()).run(any(ScriptRequest.class));
    }

    @Test
    public void unchangedFileDoesNotTrigger()
            throws Exception
    {
        Instant now = Instant.now();
        Path path = newWatchedFile("input.csv", now.minusSeconds(3600));
        jobManager.createJob(job("alice", "import").watchedPath(path.toString()).build());

        assertThat(poller.runPollOnce(now), is(0));
        assertThat(poller.runPollOnce(now.plusSeconds(60)), is(0));
        verify(runner, never()).run(any(ScriptRequest.class));
    }

    @Test
    public void modifiedFileTriggersOnce()
            throws Exception
    {
        Instant now = Instant.now();
        Path path = newWatchedFile("input.csv", now.minusSeconds(3600));
        StoredJob job = jobManager.createJob(job("alice", "import").watchedPath(path.toString()).build());

        Instant modified = now.minusSeconds(10).truncatedTo(ChronoUnit.SECONDS);
        touch(path, modified);

        assertThat(poller.runPollOnce(now), is(1));
        assertThat(poller.runPollOnce(now.plusSeconds(60)), is(0));

        verify(runner, times(1)).run(argThat(request -> request.getSource() == TriggerSource.FILE));
        assertThat(store.getJobById(job.getId()).getLastSeenMtime(), is(Optional.of(modified)));
    }

    @Test
    public void fileCreatedAfterRegistrationTriggers()
            throws Exception
    {
        Instant now = Instant.now();
        Path path = folder.getRoot().toPath().resolve("later.csv");
        jobManager.createJob(job("alice", "import").watchedPath(path.toString()).build());

        assertThat(poller.runPollOnce(now), is(0));

        Files.createFile(path);
        touch(path, now.minusSeconds(5));
        assertThat(poller.runPollOnce(now), is(1));
        verifyRuns(1);
    }

    @Test
    public void writeByTheJobItselfDoesNotTriggerIt()
            throws Exception
    {
        Path path = newWatchedFile("state.json", Instant.now().minusSeconds(3600));
        StoredJob job = jobManager.createJob(job("alice", "rewrite").watchedPath(path.toString()).build());
        when(runner.run(any(ScriptRequest.class))).thenAnswer(invocation -> {
            touch(path, Instant.now());
            return ScriptResult.succeeded(Optional.absent());
        });

        coordinator.execute(job.getId(), Trigger.manual("alice"));
        verifyRuns(1);

        Instant now = Instant.now();
        assertThat(poller.runPollOnce(now), is(0));
        assertThat(poller.runPollOnce(now.plusSeconds(60)), is(0));
        verifyRuns(1);

        // a later change by someone else still triggers
        Instant external = store.getJobById(job.getId()).getLastRunFinishedAt().get().plusSeconds(60);
        touch(path, external);
        assertThat(poller.runPollOnce(external.plusSeconds(1)), is(1));
        verifyRuns(2);
    }

    @Test
    public void oneBrokenJobDoesNotBlockOthers()
            throws Exception
    {
        Instant now = Instant.now();
        StoredJob broken = jobManager.createJob(job("alice", "broken").dueTime(now.minusSeconds(20)).build());
        StoredJob healthy = jobManager.createJob(job("alice", "healthy").dueTime(now.minusSeconds(10)).build());
        doThrow(new StoreUnavailableException("timeout"))
            .when(store).getJobById(broken.getId());

        assertThat(poller.runPollOnce(now), is(1));

        verify(runner).run(argThat(request -> request != null && request.getJobId() == healthy.getId()));
        verifyRuns(1);
        // retried on the next tick
        assertThat(store.getDueJobs(now, 10).stream().map(StoredJob::getId).collect(toList()), contains(broken.getId()));
    }

    @Test
    public void storeOutageSkipsOnlyTheFailedQuery()
            throws Exception
    {
        Instant now = Instant.now();
        Path path = newWatchedFile("input.csv", now.minusSeconds(3600));
        jobManager.createJob(job("alice", "import").watchedPath(path.toString()).build());
        touch(path, now.minusSeconds(1));
        doThrow(new StoreUnavailableException("connection refused"))
            .when(store).getDueJobs(any(Instant.class), anyInt());

        assertThat(poller.runPollOnce(now), is(1));
        verifyRuns(1);
    }

    @Test
    public void missingWatchedPathIsIgnored()
            throws Exception
    {
        Instant now = Instant.now();
        jobManager.createJob(job("alice", "ghost").watchedPath(folder.getRoot().toPath().resolve("missing").toString()).build());

        assertThat(poller.runPollOnce(now), is(0));
    }

    @Test
    public void pollerDisabledByConfig()
    {
        TriggerPoller disabled = new TriggerPoller(store, new StoredFileWatchState(store), new SelfTouchPolicy(Duration.ZERO),
                coordinator, ScheduleConfig.defaultBuilder().enabled(false).build());
        disabled.start();
        assertThat(disabled.isStarted(), is(false));
    }

    @Test
    public void startAndShutdown()
            throws Exception
    {
        poller.start();
        assertThat(poller.isStarted(), is(true));
        poller.shutdown();
        assertThat(poller.isStarted(), is(false));
    }
}
