package io.jobrelay.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A single script invocation. The runner must execute it with the identity of
 * {@link #getOwnerId()} and nothing else.
 */
@Value.Immutable
public interface ScriptRequest
{
    long getJobId();

    String getJobName();

    String getOwnerId();

    String getScriptRef();

    String getRunId();

    TriggerSource getSource();

    Optional<String> getCallerId();

    static ImmutableScriptRequest.Builder builder()
    {
        return ImmutableScriptRequest.builder();
    }
}
