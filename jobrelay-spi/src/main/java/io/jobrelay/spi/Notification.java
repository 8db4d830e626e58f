package io.jobrelay.spi;

import java.time.Instant;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableNotification.class)
@JsonDeserialize(as = ImmutableNotification.class)
public interface Notification
{
    @JsonProperty("timestamp")
    Instant getTimestamp();

    @JsonProperty("message")
    String getMessage();

    @JsonProperty("job_id")
    long getJobId();

    @JsonProperty("job_name")
    String getJobName();

    // delivery channel is derived from this, e.g. "telegram:1234"
    @JsonProperty("owner_id")
    String getOwnerId();

    @JsonProperty("run_id")
    String getRunId();

    @JsonProperty("success")
    boolean getSuccess();

    @JsonProperty("source")
    TriggerSource getSource();

    @JsonProperty("output")
    Optional<String> getOutput();

    @JsonProperty("error")
    Optional<String> getError();

    static ImmutableNotification.Builder builder(Instant timestamp, String message)
    {
        return ImmutableNotification.builder()
                .timestamp(timestamp)
                .message(message);
    }
}
