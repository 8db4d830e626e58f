package io.jobrelay.client.api;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestCommandReply.class)
public interface RestCommandReply
{
    String getReply();

    static ImmutableRestCommandReply.Builder builder()
    {
        return ImmutableRestCommandReply.builder();
    }
}
