package io.jobrelay.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobDeletion.class)
public interface RestJobDeletion
{
    long getJobId();

    // true if the job was only disabled because other jobs still chain to it
    boolean getSoftDeleted();

    static ImmutableRestJobDeletion.Builder builder()
    {
        return ImmutableRestJobDeletion.builder();
    }
}
