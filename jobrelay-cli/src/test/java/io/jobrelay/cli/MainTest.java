package io.jobrelay.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class MainTest
{
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Main main;

    @Before
    public void setUp()
            throws Exception
    {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        main = new Main(ImmutableMap.of(), new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
    }

    private String stderr()
    {
        return new String(err.toByteArray(), UTF_8);
    }

    @Test
    public void usageWithoutArguments()
    {
        assertThat(main.cli(), is(0));
        assertThat(stderr(), containsString("Usage: jobrelay <command> [options...]"));
    }

    @Test
    public void unknownCommand()
    {
        assertThat(main.cli("deploy"), is(1));
        assertThat(stderr(), containsString("available commands are: [server]"));
    }

    @Test
    public void serverHelp()
    {
        assertThat(main.cli("server", "--help"), is(0));
        assertThat(stderr(), containsString("Usage: jobrelay server [options...]"));
        assertThat(stderr(), containsString("--disable-poller"));
    }

    @Test
    public void unknownLogLevel()
    {
        assertThat(main.cli("server", "-l", "loud"), is(1));
        assertThat(stderr(), containsString("error: Unknown log level 'loud'"));
    }

    @Test
    public void paramWithoutValue()
    {
        assertThat(main.cli("server", "-p", "poller.enabled"), is(1));
        assertThat(stderr(), containsString("expected a value of the form a=b"));
    }
}
