package io.jobrelay.core.execution;

import com.google.common.base.Optional;
import org.slf4j.MDC;

/**
 * Identity a run executes under. Opened by the coordinator around a script
 * invocation and closed when the invocation returns, on the same thread.
 */
public final class ExecutionContext
        implements AutoCloseable
{
    private static final ThreadLocal<ExecutionContext> CURRENT = new ThreadLocal<>();

    static final String MDC_OWNER = "owner";
    static final String MDC_JOB = "job";
    static final String MDC_RUN = "run";

    public static ExecutionContext open(String ownerId, long jobId, String runId)
    {
        if (CURRENT.get() != null) {
            throw new IllegalStateException("Execution context of " + CURRENT.get().ownerId + " is still open on this thread");
        }
        ExecutionContext context = new ExecutionContext(ownerId, jobId, runId);
        CURRENT.set(context);
        MDC.put(MDC_OWNER, ownerId);
        MDC.put(MDC_JOB, Long.toString(jobId));
        MDC.put(MDC_RUN, runId);
        return context;
    }

    public static Optional<ExecutionContext> current()
    {
        return Optional.fromNullable(CURRENT.get());
    }

    private final String ownerId;
    private final long jobId;
    private final String runId;

    private ExecutionContext(String ownerId, long jobId, String runId)
    {
        this.ownerId = ownerId;
        this.jobId = jobId;
        this.runId = runId;
    }

    public String getOwnerId()
    {
        return ownerId;
    }

    public long getJobId()
    {
        return jobId;
    }

    public String getRunId()
    {
        return runId;
    }

    @Override
    public void close()
    {
        CURRENT.remove();
        MDC.remove(MDC_OWNER);
        MDC.remove(MDC_JOB);
        MDC.remove(MDC_RUN);
    }
}
