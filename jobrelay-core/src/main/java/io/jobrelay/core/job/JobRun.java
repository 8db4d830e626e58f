package io.jobrelay.core.job;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.jobrelay.spi.TriggerSource;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobRun.class)
@JsonDeserialize(as = ImmutableJobRun.class)
public interface JobRun
{
    String getRunId();

    long getJobId();

    TriggerSource getSource();

    JobRunStatus getStatus();

    Instant getStartedAt();

    Optional<Instant> getFinishedAt();

    Optional<String> getOutput();

    Optional<String> getError();

    static JobRun started(String runId, long jobId, TriggerSource source, Instant startedAt)
    {
        return ImmutableJobRun.builder()
            .runId(runId)
            .jobId(jobId)
            .source(source)
            .status(JobRunStatus.RUNNING)
            .startedAt(startedAt)
            .build();
    }
}
