package io.jobrelay.client.api;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobRunCollection.class)
public interface RestJobRunCollection
{
    List<RestJobRun> getRuns();

    static ImmutableRestJobRunCollection.Builder builder()
    {
        return ImmutableRestJobRunCollection.builder();
    }
}
