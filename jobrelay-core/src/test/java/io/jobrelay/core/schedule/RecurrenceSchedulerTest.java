package io.jobrelay.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.core.job.MemoryJobStore;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.spi.Scheduler;
import org.junit.Before;
import org.junit.Test;

import static io.jobrelay.core.CoreTestUtils.everySeconds;
import static io.jobrelay.core.CoreTestUtils.job;
import static io.jobrelay.core.CoreTestUtils.newConfig;
import static io.jobrelay.core.CoreTestUtils.newSchedulerManager;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class RecurrenceSchedulerTest
{
    private final Instant t0 = Instant.parse("2024-03-01T10:00:00Z");

    private MemoryJobStore store;
    private SchedulerManager srm;
    private RecurrenceScheduler collapsing;
    private RecurrenceScheduler catchingUp;

    @Before
    public void setUp()
    {
        store = new MemoryJobStore(20);
        srm = newSchedulerManager();
        collapsing = new RecurrenceScheduler(srm, store, MissedRunPolicy.COLLAPSE);
        catchingUp = new RecurrenceScheduler(srm, store, MissedRunPolicy.CATCH_UP);
    }

    @Test
    public void firstDueTimeIsAligned()
    {
        assertThat(collapsing.firstDueTime(everySeconds(300), t0.plusSeconds(1)), is(Optional.of(t0.plusSeconds(300))));
        assertThat(collapsing.firstDueTime(everySeconds(300), t0), is(Optional.of(t0)));
    }

    @Test(expected = ConfigException.class)
    public void rejectUnknownRuleType()
    {
        collapsing.firstDueTime(newConfig().set("fortnightly>", 1), t0);
    }

    @Test(expected = ConfigException.class)
    public void rejectRuleWithoutType()
    {
        collapsing.firstDueTime(newConfig().set("timezone", "UTC"), t0);
    }

    @Test
    public void nextIsAnchoredToPreviousDueTimeNotRunTime()
    {
        // ran 40 seconds late
        Instant now = t0.plusSeconds(40);
        assertThat(collapsing.nextDueTime(everySeconds(600), t0, now), is(Optional.of(t0.plusSeconds(600))));
    }

    @Test
    public void missedOccurrencesCollapseIntoOne()
    {
        // 5 minute job left unpolled for 1 hour
        Instant now = t0.plusSeconds(3600 + 30);
        Optional<Instant> next = collapsing.nextDueTime(everySeconds(300), t0, now);

        assertThat(next, is(Optional.of(t0.plusSeconds(3900))));
        assertThat(next.get(), greaterThan(now));
    }

    @Test
    public void catchUpPolicyReturnsEachMissedOccurrence()
    {
        Instant now = t0.plusSeconds(3600 + 30);
        assertThat(catchingUp.nextDueTime(everySeconds(300), t0, now), is(Optional.of(t0.plusSeconds(300))));
    }

    @Test
    public void noOccurrenceAtOrAfterEndDate()
    {
        Scheduler scheduler = mock(Scheduler.class);
        when(scheduler.nextScheduleTime(t0)).thenReturn(t0.plusSeconds(60));
        when(scheduler.getEndDate()).thenReturn(Optional.of(t0.plusSeconds(60)));

        assertThat(collapsing.nextDueTime(scheduler, t0, t0), is(Optional.absent()));
    }

    @Test(expected = IllegalStateException.class)
    public void ruleThatDoesNotMoveForwardIsAnError()
    {
        Scheduler scheduler = mock(Scheduler.class);
        when(scheduler.nextScheduleTime(t0)).thenReturn(t0);

        collapsing.nextDueTime(scheduler, t0, t0);
    }

    @Test
    public void advanceAfterScheduledRunMovesDueTimeStrictlyForward()
            throws Exception
    {
        StoredJob job = store.createJob(job("alice", "report").recurrence(everySeconds(600)).dueTime(t0).build(), t0);

        Optional<Instant> next = collapsing.advanceAfterScheduledRun(job.getId(), t0, t0.plusSeconds(5));

        assertThat(next, is(Optional.of(t0.plusSeconds(600))));
        assertThat(store.getJobById(job.getId()).getDueTime(), is(next));
    }

    @Test
    public void oneShotJobIsClearedAfterItsRun()
            throws Exception
    {
        StoredJob job = store.createJob(job("alice", "once").dueTime(t0).build(), t0);

        collapsing.advanceAfterScheduledRun(job.getId(), t0, t0.plusSeconds(5));

        assertThat(store.getJobById(job.getId()).getDueTime(), is(Optional.absent()));
    }

    @Test
    public void dueTimeChangedDuringRunIsKept()
            throws Exception
    {
        StoredJob job = store.createJob(job("alice", "report").recurrence(everySeconds(600)).dueTime(t0).build(), t0);
        Instant rescheduled = t0.plusSeconds(7200);
        store.updateJobById(job.getId(), (cs, j) -> { cs.updateDueTime(j.getId(), Optional.of(rescheduled)); return null; });

        Optional<Instant> next = collapsing.advanceAfterScheduledRun(job.getId(), t0, t0.plusSeconds(5));

        assertThat(next, is(Optional.of(rescheduled)));
        assertThat(store.getJobById(job.getId()).getDueTime(), is(Optional.of(rescheduled)));
    }

    @Test
    public void scheduleConfigFromSystemConfig()
    {
        ScheduleConfig config = ScheduleConfig.convertFrom(newConfig()
                .set("poller.interval", "30")
                .set("schedule.missed_run_policy", "catch_up")
                .set("file_watch.self_touch_grace", "1m"));

        assertThat(config.getEnabled(), is(true));
        assertThat(config.getPollInterval().getSeconds(), is(30L));
        assertThat(config.getMissedRunPolicy(), is(MissedRunPolicy.CATCH_UP));
        assertThat(config.getSelfTouchGrace().getSeconds(), is(60L));
        assertThat(config.getDueJobLimit(), is(ScheduleConfig.DEFAULT_DUE_JOB_LIMIT));
    }
}
