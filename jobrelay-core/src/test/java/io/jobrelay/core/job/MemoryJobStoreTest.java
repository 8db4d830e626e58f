package io.jobrelay.core.job;

import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.spi.TriggerSource;
import org.junit.Before;
import org.junit.Test;

import static io.jobrelay.core.CoreTestUtils.job;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class MemoryJobStoreTest
{
    private final Instant now = Instant.parse("2024-03-01T10:00:00Z");

    private MemoryJobStore store;

    @Before
    public void setUp()
    {
        store = new MemoryJobStore(3);
    }

    @Test
    public void createAndGet()
            throws Exception
    {
        StoredJob created = store.createJob(job("alice", "backup").build(), now);

        StoredJob loaded = store.getJobById(created.getId());
        assertThat(loaded.getName(), is("backup"));
        assertThat(loaded.getOwnerId(), is("alice"));
        assertThat(loaded.getEnabled(), is(true));
        assertThat(loaded.getNotifyOnFailure(), is(true));
        assertThat(loaded.getCreatedAt(), is(now));
        assertThat(loaded.getDependents(), is(empty()));
        assertThat(loaded.getExecutionLease(), is(Optional.absent()));
    }

    @Test(expected = ResourceNotFoundException.class)
    public void getMissingJob()
            throws Exception
    {
        store.getJobById(42);
    }

    @Test
    public void rejectDuplicatedNameOfSameOwner()
            throws Exception
    {
        store.createJob(job("alice", "backup").build(), now);
        // another owner may use the same name
        store.createJob(job("bob", "backup").build(), now);
        try {
            store.createJob(job("alice", "backup").build(), now);
            fail();
        }
        catch (ResourceConflictException ex) {
            assertThat(store.getJobsByOwner("alice").size(), is(1));
        }
    }

    @Test
    public void dueJobsAreEnabledAndOrderedByDueTime()
            throws Exception
    {
        StoredJob late = store.createJob(job("alice", "late").dueTime(now.minusSeconds(10)).build(), now);
        StoredJob early = store.createJob(job("alice", "early").dueTime(now.minusSeconds(60)).build(), now);
        store.createJob(job("alice", "future").dueTime(now.plusSeconds(1)).build(), now);
        store.createJob(job("alice", "disabled").dueTime(now.minusSeconds(100)).enabled(false).build(), now);
        store.createJob(job("alice", "unscheduled").build(), now);

        List<Long> due = store.getDueJobs(now, 10).stream().map(StoredJob::getId).collect(toList());
        assertThat(due, contains(early.getId(), late.getId()));

        assertThat(store.getDueJobs(now, 1).size(), is(1));
    }

    @Test
    public void leaseCompareAndSet()
            throws Exception
    {
        long id = store.createJob(job("alice", "backup").build(), now).getId();
        ExecutionLease first = ExecutionLease.of("run-1", now.plusSeconds(60));
        ExecutionLease second = ExecutionLease.of("run-2", now.plusSeconds(60));

        assertThat(store.compareAndSetLease(id, Optional.absent(), Optional.of(first)), is(true));
        assertThat(store.compareAndSetLease(id, Optional.absent(), Optional.of(second)), is(false));
        assertThat(store.getJobById(id).getExecutionLease(), is(Optional.of(first)));

        assertThat(store.compareAndSetLease(id, Optional.of(first), Optional.absent()), is(true));
        assertThat(store.getJobById(id).getExecutionLease(), is(Optional.absent()));
    }

    @Test
    public void lastSeenMtimeNeverMovesBackward()
            throws Exception
    {
        long id = store.createJob(job("alice", "watch").watchedPath("/tmp/x").build(), now).getId();

        boolean first = store.updateJobById(id, (cs, job) -> cs.advanceLastSeenMtime(id, now));
        boolean older = store.updateJobById(id, (cs, job) -> cs.advanceLastSeenMtime(id, now.minusSeconds(1)));
        boolean same = store.updateJobById(id, (cs, job) -> cs.advanceLastSeenMtime(id, now));

        assertThat(first, is(true));
        assertThat(older, is(false));
        assertThat(same, is(false));
        assertThat(store.getJobById(id).getLastSeenMtime(), is(Optional.of(now)));
    }

    @Test
    public void dependentsAndParents()
            throws Exception
    {
        long a = store.createJob(job("alice", "a").build(), now).getId();
        long b = store.createJob(job("alice", "b").build(), now).getId();
        long c = store.createJob(job("alice", "c").build(), now).getId();

        store.updateJobById(a, (cs, job) -> { cs.addDependent(a, b); cs.addDependent(a, c); return null; });
        assertThat(store.getJobById(a).getDependents(), is(ImmutableSet.of(b, c)));
        assertThat(store.getParents(b).stream().map(StoredJob::getId).collect(toList()), contains(a));

        store.updateJobById(a, (cs, job) -> { cs.removeDependent(a, b); return null; });
        assertThat(store.getJobById(a).getDependents(), is(ImmutableSet.of(c)));
        assertThat(store.getParents(b), is(empty()));
    }

    @Test
    public void runHistoryIsBounded()
            throws Exception
    {
        long id = store.createJob(job("alice", "backup").build(), now).getId();
        for (int i = 0; i < 5; i++) {
            store.putRun(JobRun.started("run-" + i, id, TriggerSource.MANUAL, now.plusSeconds(i)));
        }
        // finishing a run replaces its entry
        store.putRun(ImmutableJobRun.builder()
                .from(JobRun.started("run-4", id, TriggerSource.MANUAL, now.plusSeconds(4)))
                .status(JobRunStatus.SUCCESS)
                .finishedAt(now.plusSeconds(5))
                .build());

        List<JobRun> runs = store.getRuns(id, 10);
        assertThat(runs.stream().map(JobRun::getRunId).collect(toList()), contains("run-4", "run-3", "run-2"));
        assertThat(runs.get(0).getStatus(), is(JobRunStatus.SUCCESS));
    }

    @Test
    public void deleteRemovesHistory()
            throws Exception
    {
        long id = store.createJob(job("alice", "backup").build(), now).getId();
        store.putRun(JobRun.started("run-1", id, TriggerSource.WEBHOOK, now));
        store.putTriggerEvent(TriggerEvent.of(id, TriggerSource.WEBHOOK, Optional.absent(), now));

        store.deleteJobById(id);

        assertThat(store.getRuns(id, 10), is(empty()));
        assertThat(store.getTriggerEvents(id, 10), is(empty()));
        try {
            store.getJobById(id);
            fail();
        }
        catch (ResourceNotFoundException expected) {
        }
    }

    @Test
    public void updateDefinitionKeepsSchedulingState()
            throws Exception
    {
        long id = store.createJob(job("alice", "backup").build(), now).getId();
        store.updateJobById(id, (cs, job) -> { cs.updateLastRunAt(id, now); return null; });

        store.updateJobById(id, (cs, job) -> {
            new JobControl(cs, job).updateDefinition(ImmutableJob.builder().from(job).scriptRef("echo v2").build());
            return null;
        });

        StoredJob updated = store.getJobById(id);
        assertThat(updated.getScriptRef(), is("echo v2"));
        assertThat(updated.getLastRunAt(), is(Optional.of(now)));
    }
}
