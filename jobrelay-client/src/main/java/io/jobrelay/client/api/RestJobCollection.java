package io.jobrelay.client.api;

import java.util.List;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestJobCollection.class)
public interface RestJobCollection
{
    List<RestJob> getJobs();

    static ImmutableRestJobCollection.Builder builder()
    {
        return ImmutableRestJobCollection.builder();
    }
}
