package io.jobrelay.core.execution;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface TriggerResult
{
    enum Status
    {
        // a run was started or queued
        ACCEPTED,

        // another run holds the lease. not retried automatically.
        ALREADY_RUNNING,

        // job is disabled. treated as a successful no-op.
        DISABLED,

        // all workers and queue slots are busy. the caller may retry.
        REJECTED,

        // scheduler trigger for an occurrence that already ran
        SKIPPED;
    }

    Status getStatus();

    // run id of the accepted run, or of the run holding the lease
    Optional<String> getRunId();

    default boolean isRetryable()
    {
        return getStatus() == Status.REJECTED;
    }

    static TriggerResult accepted(String runId)
    {
        return ImmutableTriggerResult.builder().status(Status.ACCEPTED).runId(runId).build();
    }

    static TriggerResult alreadyRunning(String holderId)
    {
        return ImmutableTriggerResult.builder().status(Status.ALREADY_RUNNING).runId(holderId).build();
    }

    static TriggerResult disabled()
    {
        return ImmutableTriggerResult.builder().status(Status.DISABLED).build();
    }

    static TriggerResult rejected()
    {
        return ImmutableTriggerResult.builder().status(Status.REJECTED).build();
    }

    static TriggerResult skipped()
    {
        return ImmutableTriggerResult.builder().status(Status.SKIPPED).build();
    }
}
