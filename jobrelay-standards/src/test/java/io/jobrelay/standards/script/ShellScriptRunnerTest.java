package io.jobrelay.standards.script;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import com.google.common.base.Optional;
import io.jobrelay.spi.ScriptRequest;
import io.jobrelay.spi.ScriptResult;
import io.jobrelay.spi.TriggerSource;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

public class ShellScriptRunnerTest
{
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private Path root;
    private ShellScriptRunner runner;

    @Before
    public void setUp()
            throws Exception
    {
        root = folder.newFolder("workspace").toPath();
        runner = new ShellScriptRunner(root, Duration.ofSeconds(30), 1024);
    }

    private static ScriptRequest request(String ownerId, String script)
    {
        return ScriptRequest.builder()
            .jobId(7)
            .jobName("test")
            .ownerId(ownerId)
            .scriptRef(script)
            .runId("run-1")
            .source(TriggerSource.WEBHOOK)
            .build();
    }

    @Test
    public void capturesOutput()
            throws Exception
    {
        ScriptResult result = runner.run(request("alice", "echo hello"));

        assertThat(result.isSuccess(), is(true));
        assertThat(result.getOutput(), is(Optional.of("hello\n")));
    }

    @Test
    public void stderrIsCaptured()
            throws Exception
    {
        ScriptResult result = runner.run(request("alice", "echo oops >&2"));

        assertThat(result.getOutput(), is(Optional.of("oops\n")));
    }

    @Test
    public void nonZeroExitIsFailure()
            throws Exception
    {
        ScriptResult result = runner.run(request("alice", "echo partial; exit 3"));

        assertThat(result.isSuccess(), is(false));
        assertThat(result.getError(), is(Optional.of("Script exited with code 3")));
        assertThat(result.getOutput(), is(Optional.of("partial\n")));
    }

    @Test
    public void environment()
            throws Exception
    {
        ScriptResult result = runner.run(request("alice", "echo $JOBRELAY_JOB_ID $JOBRELAY_OWNER_ID $JOBRELAY_RUN_ID $JOBRELAY_TRIGGER"));

        assertThat(result.getOutput(), is(Optional.of("7 alice run-1 webhook\n")));
    }

    @Test
    public void runsInOwnerWorkspace()
            throws Exception
    {
        runner.run(request("telegram:123", "echo data > out.txt"));

        Path workspace = runner.workspaceOf("telegram:123");
        assertThat(workspace.getFileName().toString(), startsWith("telegram_123-"));
        Path written = workspace.resolve("out.txt");
        assertThat(Files.exists(written), is(true));
        assertThat(new String(Files.readAllBytes(written), "UTF-8"), is("data\n"));
    }

    @Test
    public void ownersWithSimilarIdsDoNotShareWorkspace()
            throws Exception
    {
        assertThat(runner.workspaceOf("telegram:42"), is(not(runner.workspaceOf("telegram_42"))));
        assertThat(runner.workspaceOf("telegram:42"), is(runner.workspaceOf("telegram:42")));

        runner.run(request("telegram:42", "echo secret > note.txt"));
        ScriptResult result = runner.run(request("telegram_42", "cat note.txt 2>/dev/null || echo missing"));

        assertThat(result.getOutput(), is(Optional.of("missing\n")));
    }

    @Test
    public void ownersCannotEscapeWorkspaceRoot()
    {
        assertThat(ShellScriptRunner.sanitize("../etc"), is("_._etc"));
        assertThat(ShellScriptRunner.sanitize("a/b"), is("a_b"));
        assertThat(runner.workspaceOf("..").getParent(), is(root.toAbsolutePath().normalize()));
    }

    @Test
    public void outputIsTruncated()
            throws Exception
    {
        ShellScriptRunner small = new ShellScriptRunner(root, Duration.ofSeconds(30), 10);

        ScriptResult result = small.run(request("alice", "printf abcdefghijklmnopqrstuvwxyz"));

        assertThat(result.getOutput(), is(Optional.of("abcdefghij\n... (16 bytes truncated)")));
    }

    @Test
    public void emptyOutputIsAbsent()
            throws Exception
    {
        assertThat(runner.run(request("alice", "true")).getOutput(), is(Optional.absent()));
    }

    @Test
    public void timeout()
            throws Exception
    {
        ShellScriptRunner quick = new ShellScriptRunner(root, Duration.ofSeconds(1), 1024);

        long start = System.nanoTime();
        ScriptResult result = quick.run(request("alice", "exec sleep 30"));

        assertThat(result.isSuccess(), is(false));
        assertThat(result.getError().get(), startsWith("Script timed out after 1s"));
        assertThat(Duration.ofNanos(System.nanoTime() - start).getSeconds() < 20, is(true));
    }

    @Test
    public void scriptRefIsPassedToShell()
            throws Exception
    {
        ScriptResult result = runner.run(request("alice", "for i in 1 2; do echo $i; done | tail -n 1"));

        assertThat(result.getOutput().get(), endsWith("2\n"));
    }
}
