package io.jobrelay.spi;

import com.google.common.base.Optional;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ScriptResultTest
{
    @Test
    public void succeededKeepsOutput()
    {
        ScriptResult result = ScriptResult.succeeded(Optional.of("done"));

        assertThat(result.isSuccess(), is(true));
        assertThat(result.getOutput(), is(Optional.of("done")));
        assertThat(result.getError(), is(Optional.absent()));
    }

    @Test
    public void failedCarriesError()
    {
        ScriptResult result = ScriptResult.failed("exit code 2", Optional.absent());

        assertThat(result.isSuccess(), is(false));
        assertThat(result.getError(), is(Optional.of("exit code 2")));
    }
}
