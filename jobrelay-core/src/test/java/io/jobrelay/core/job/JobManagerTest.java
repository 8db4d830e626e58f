package io.jobrelay.core.job;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import com.google.common.base.Optional;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.core.chain.ChainPolicy;
import io.jobrelay.core.chain.ChainResolver;
import io.jobrelay.core.chain.DependencyCycleException;
import io.jobrelay.core.chain.JobDeletion;
import io.jobrelay.core.execution.ExecutionCoordinator;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.schedule.RecurrenceScheduler;
import io.jobrelay.core.schedule.ScheduleConfig;
import io.jobrelay.core.watch.StoredFileWatchState;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static io.jobrelay.core.CoreTestUtils.everySeconds;
import static io.jobrelay.core.CoreTestUtils.job;
import static io.jobrelay.core.CoreTestUtils.newConfig;
import static io.jobrelay.core.CoreTestUtils.newSchedulerManager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

public class JobManagerTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private MemoryJobStore store;
    private JobManager manager;

    @Before
    public void setUp()
    {
        store = new MemoryJobStore(20);
        RecurrenceScheduler recurrenceScheduler = new RecurrenceScheduler(newSchedulerManager(), store, ScheduleConfig.defaultBuilder().build());
        ExecutionCoordinator coordinator = mock(ExecutionCoordinator.class);
        ChainResolver chainResolver = new ChainResolver(store, () -> coordinator, ChainPolicy.ALWAYS);
        manager = new JobManager(store, recurrenceScheduler, chainResolver, new StoredFileWatchState(store));
    }

    @Test
    public void recurringJobIsDueAtFirstOccurrence()
            throws Exception
    {
        Instant before = Instant.now();
        StoredJob job = manager.createJob(job("alice", "report").recurrence(everySeconds(60)).build());

        Instant due = job.getDueTime().get();
        assertThat(due.getEpochSecond() % 60, is(0L));
        assertThat(due.plusSeconds(60), greaterThan(before));
    }

    @Test
    public void explicitDueTimeIsKept()
            throws Exception
    {
        Instant due = Instant.parse("2030-01-01T00:00:00Z");
        StoredJob job = manager.createJob(job("alice", "report").recurrence(everySeconds(60)).dueTime(due).build());

        assertThat(job.getDueTime(), is(Optional.of(due)));
    }

    @Test(expected = ConfigException.class)
    public void invalidRecurrenceIsRejected()
            throws Exception
    {
        manager.createJob(job("alice", "report").recurrence(newConfig().set("hourly>", true)).build());
    }

    @Test(expected = ResourceConflictException.class)
    public void duplicatedName()
            throws Exception
    {
        manager.createJob(job("alice", "report").build());
        manager.createJob(job("alice", "report").build());
    }

    @Test
    public void watchedFileIsRecordedAtRegistration()
            throws Exception
    {
        Path path = folder.newFile("input.csv").toPath();
        Instant mtime = Instant.parse("2024-03-01T10:00:00Z");
        Files.setLastModifiedTime(path, FileTime.from(mtime));

        StoredJob job = manager.createJob(job("alice", "import").watchedPath(path.toString()).build());

        assertThat(job.getLastSeenMtime(), is(Optional.of(mtime)));
    }

    @Test(expected = AccessDeniedException.class)
    public void otherUsersCannotReadJob()
            throws Exception
    {
        StoredJob job = manager.createJob(job("alice", "report").build());
        manager.getJob("bob", job.getId());
    }

    @Test(expected = AccessDeniedException.class)
    public void ownerCannotBeChanged()
            throws Exception
    {
        StoredJob job = manager.createJob(job("alice", "report").build());
        manager.updateJob("alice", job.getId(), job("bob", "report").build());
    }

    @Test
    public void update()
            throws Exception
    {
        StoredJob job = manager.createJob(job("alice", "report").build());

        StoredJob updated = manager.updateJob("alice", job.getId(), job("alice", "weekly-report").notifyOnSuccess(true).build());

        assertThat(updated.getName(), is("weekly-report"));
        assertThat(updated.getNotifyOnSuccess(), is(true));
        assertThat(updated.getCreatedAt(), is(job.getCreatedAt()));
    }

    @Test
    public void enablingOverdueRecurringJobSkipsMissedOccurrences()
            throws Exception
    {
        Instant longAgo = Instant.now().minusSeconds(86400);
        StoredJob job = manager.createJob(job("alice", "report").recurrence(everySeconds(60)).dueTime(longAgo).enabled(false).build());

        Instant now = Instant.now();
        StoredJob enabled = manager.enableJob("alice", job.getId());

        assertThat(enabled.getEnabled(), is(true));
        assertThat(enabled.getDueTime().get().plusSeconds(60), greaterThan(now));
    }

    @Test
    public void disable()
            throws Exception
    {
        StoredJob job = manager.createJob(job("alice", "report").build());

        assertThat(manager.disableJob("alice", job.getId()).getEnabled(), is(false));
    }

    @Test
    public void dependencyEdgesRequireOwnershipOfBothJobs()
            throws Exception
    {
        StoredJob mine = manager.createJob(job("alice", "extract").build());
        StoredJob theirs = manager.createJob(job("bob", "load").build());
        try {
            manager.addDependent("alice", mine.getId(), theirs.getId());
            fail();
        }
        catch (AccessDeniedException expected) {
            assertThat(store.getJobById(mine.getId()).getDependents().isEmpty(), is(true));
        }
    }

    @Test(expected = DependencyCycleException.class)
    public void cycleIsRejected()
            throws Exception
    {
        StoredJob a = manager.createJob(job("alice", "a").build());
        StoredJob b = manager.createJob(job("alice", "b").build());
        manager.addDependent("alice", a.getId(), b.getId());
        manager.addDependent("alice", b.getId(), a.getId());
    }

    @Test
    public void deleteDependentIsSoft()
            throws Exception
    {
        StoredJob a = manager.createJob(job("alice", "a").build());
        StoredJob b = manager.createJob(job("alice", "b").build());
        manager.addDependent("alice", a.getId(), b.getId());

        assertThat(manager.deleteJob("alice", b.getId()), is(JobDeletion.SOFT_DELETED));
        assertThat(manager.deleteJob("alice", a.getId()), is(JobDeletion.DELETED));
        // b has no parent any more
        assertThat(manager.deleteJob("alice", b.getId()), is(JobDeletion.DELETED));
        assertThat(manager.getJobs("alice").isEmpty(), is(true));
    }
}
