package io.jobrelay.core.execution;

import java.time.Instant;
import com.google.common.base.Optional;
import io.jobrelay.spi.TriggerSource;
import org.immutables.value.Value;

/**
 * One trigger event as seen by {@link ExecutionCoordinator}. The source decides
 * which of the optional fields are set.
 */
@Value.Immutable
public abstract class Trigger
{
    public abstract TriggerSource getSource();

    // MANUAL
    public abstract Optional<String> getCallerId();

    // SCHEDULER: the dueTime that fired
    public abstract Optional<Instant> getDueTime();

    // FILE
    public abstract Optional<Instant> getObservedMtime();

    // COMPLETION
    public abstract Optional<Long> getParentJobId();

    public abstract Optional<Boolean> getParentSucceeded();

    @Value.Check
    protected void check()
    {
        switch (getSource()) {
        case SCHEDULER:
            checkPresent(getDueTime(), "dueTime");
            break;
        case FILE:
            checkPresent(getObservedMtime(), "observedMtime");
            break;
        case MANUAL:
            checkPresent(getCallerId(), "callerId");
            break;
        case COMPLETION:
            checkPresent(getParentJobId(), "parentJobId");
            checkPresent(getParentSucceeded(), "parentSucceeded");
            break;
        case WEBHOOK:
        default:
            break;
        }
    }

    private void checkPresent(Optional<?> value, String name)
    {
        if (!value.isPresent()) {
            throw new IllegalStateException(name + " is required for " + getSource() + " trigger");
        }
    }

    public static Trigger scheduler(Instant dueTime)
    {
        return ImmutableTrigger.builder()
            .source(TriggerSource.SCHEDULER)
            .dueTime(dueTime)
            .build();
    }

    public static Trigger webhook()
    {
        return ImmutableTrigger.builder()
            .source(TriggerSource.WEBHOOK)
            .build();
    }

    public static Trigger file(Instant observedMtime)
    {
        return ImmutableTrigger.builder()
            .source(TriggerSource.FILE)
            .observedMtime(observedMtime)
            .build();
    }

    public static Trigger manual(String callerId)
    {
        return ImmutableTrigger.builder()
            .source(TriggerSource.MANUAL)
            .callerId(callerId)
            .build();
    }

    public static Trigger completion(long parentJobId, boolean parentSucceeded)
    {
        return ImmutableTrigger.builder()
            .source(TriggerSource.COMPLETION)
            .parentJobId(parentJobId)
            .parentSucceeded(parentSucceeded)
            .build();
    }
}
