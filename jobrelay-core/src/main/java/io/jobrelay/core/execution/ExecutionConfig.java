package io.jobrelay.core.execution;

import java.time.Duration;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface ExecutionConfig
{
    int DEFAULT_MAX_CONCURRENT = 8;
    int DEFAULT_QUEUE_CAPACITY = 32;
    Duration DEFAULT_LEASE_DURATION = Duration.ofHours(1);

    // number of scripts running at the same time across all jobs
    int getMaxConcurrent();

    // accepted runs waiting for a worker. 0 rejects as soon as all workers are busy.
    int getQueueCapacity();

    // a lease not released within this duration is considered abandoned
    Duration getLeaseDuration();

    @Value.Check
    default void check()
    {
        if (getMaxConcurrent() < 1) {
            throw new ConfigException("executor.max_concurrent must be 1 or larger: " + getMaxConcurrent());
        }
        if (getQueueCapacity() < 0) {
            throw new ConfigException("executor.queue_capacity must not be negative: " + getQueueCapacity());
        }
        if (getLeaseDuration().isZero() || getLeaseDuration().isNegative()) {
            throw new ConfigException("executor.lease_duration must be positive: " + getLeaseDuration());
        }
    }

    static ImmutableExecutionConfig.Builder defaultBuilder()
    {
        return ImmutableExecutionConfig.builder()
            .maxConcurrent(DEFAULT_MAX_CONCURRENT)
            .queueCapacity(DEFAULT_QUEUE_CAPACITY)
            .leaseDuration(DEFAULT_LEASE_DURATION);
    }

    static ExecutionConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .maxConcurrent(config.get("executor.max_concurrent", int.class, DEFAULT_MAX_CONCURRENT))
            .queueCapacity(config.get("executor.queue_capacity", int.class, DEFAULT_QUEUE_CAPACITY))
            .leaseDuration(config.getDuration("executor.lease_duration", DEFAULT_LEASE_DURATION))
            .build();
    }
}
