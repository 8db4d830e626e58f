package io.jobrelay.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
@Value.Style(get = {"is*", "get*"})
public interface ScriptResult
{
    boolean isSuccess();

    Optional<String> getOutput();

    Optional<String> getError();

    static ScriptResult succeeded(Optional<String> output)
    {
        return ImmutableScriptResult.builder()
            .success(true)
            .output(output)
            .build();
    }

    static ScriptResult failed(String error, Optional<String> output)
    {
        return ImmutableScriptResult.builder()
            .success(false)
            .error(error)
            .output(output)
            .build();
    }
}
