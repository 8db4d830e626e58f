package io.jobrelay.standards.script;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.jobrelay.client.Durations;
import io.jobrelay.client.config.Config;
import io.jobrelay.core.BackgroundExecutor;
import io.jobrelay.spi.ScriptExecutionException;
import io.jobrelay.spi.ScriptRequest;
import io.jobrelay.spi.ScriptResult;
import io.jobrelay.spi.ScriptRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Runs the script reference with <code>/bin/sh -c</code> in the owner's
 * workspace directory.
 * <p>
 * Each owner gets its own directory under script.workspace_root, named after
 * the owner id and a digest of it. The process runs as the server's OS user.
 * Isolation between owners is limited to the working directory and environment.
 */
public class ShellScriptRunner
        implements ScriptRunner, BackgroundExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ShellScriptRunner.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);
    static final int DEFAULT_MAX_OUTPUT_BYTES = 64 * 1024;
    private static final int WORKSPACE_DIGEST_LENGTH = 16;

    private final Path workspaceRoot;
    private final Duration timeout;
    private final int maxOutputBytes;
    private final ExecutorService outputReaders;

    @Inject
    public ShellScriptRunner(Config systemConfig)
    {
        this(Paths.get(systemConfig.get("script.workspace_root", String.class, "workspace")),
                systemConfig.getDuration("script.timeout", DEFAULT_TIMEOUT),
                systemConfig.get("script.max_output_bytes", int.class, DEFAULT_MAX_OUTPUT_BYTES));
    }

    @VisibleForTesting
    public ShellScriptRunner(Path workspaceRoot, Duration timeout, int maxOutputBytes)
    {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.timeout = timeout;
        this.maxOutputBytes = maxOutputBytes;
        this.outputReaders = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("script-output-%d")
                .build());
    }

    @Override
    public ScriptResult run(ScriptRequest request)
        throws ScriptExecutionException
    {
        Path workspace = workspaceOf(request.getOwnerId());
        try {
            Files.createDirectories(workspace);
        }
        catch (IOException ex) {
            throw new ScriptExecutionException("Failed to create workspace " + workspace, ex);
        }

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", request.getScriptRef());
        pb.directory(workspace.toFile());
        pb.redirectErrorStream(true);
        pb.redirectInput(ProcessBuilder.Redirect.from(Paths.get("/dev/null").toFile()));
        Map<String, String> env = pb.environment();
        env.put("JOBRELAY_JOB_ID", Long.toString(request.getJobId()));
        env.put("JOBRELAY_OWNER_ID", request.getOwnerId());
        env.put("JOBRELAY_RUN_ID", request.getRunId());
        env.put("JOBRELAY_TRIGGER", request.getSource().toConfigString());

        Process process;
        try {
            process = pb.start();
        }
        catch (IOException ex) {
            throw new ScriptExecutionException("Failed to start script of job id=" + request.getJobId(), ex);
        }
        logger.debug("Started script of job id={} run={} in {}", request.getJobId(), request.getRunId(), workspace);

        Future<String> output = outputReaders.submit(() -> readOutput(process.getInputStream()));

        try {
            boolean exited = process.waitFor(timeout.toMillis(), MILLISECONDS);
            if (!exited) {
                process.destroyForcibly();
                String message = "Script timed out after " + Durations.formatDuration(timeout);
                logger.warn("{}: job id={} run={}", message, request.getJobId(), request.getRunId());
                return ScriptResult.failed(message, collect(output));
            }

            int exitCode = process.exitValue();
            Optional<String> out = collect(output);
            if (exitCode != 0) {
                return ScriptResult.failed("Script exited with code " + exitCode, out);
            }
            return ScriptResult.succeeded(out);
        }
        catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ScriptExecutionException("Interrupted while running script of job id=" + request.getJobId(), ex);
        }
    }

    @VisibleForTesting
    Path workspaceOf(String ownerId)
    {
        return workspaceRoot.resolve(workspaceName(ownerId));
    }

    // readable prefix plus a digest of the raw id. owner ids that sanitize
    // to the same prefix still get distinct directories.
    @VisibleForTesting
    static String workspaceName(String ownerId)
    {
        String digest = Hashing.sha256().hashString(ownerId, StandardCharsets.UTF_8).toString();
        return sanitize(ownerId) + "-" + digest.substring(0, WORKSPACE_DIGEST_LENGTH);
    }

    // keeps owner ids from escaping the workspace root
    @VisibleForTesting
    static String sanitize(String ownerId)
    {
        String name = ownerId.replaceAll("[^A-Za-z0-9_.-]", "_");
        if (name.startsWith(".")) {
            name = "_" + name.substring(1);
        }
        return name;
    }

    @Override
    public void eagerShutdown()
    {
        // readers finish when their process closes its output
        outputReaders.shutdown();
    }

    private String readOutput(InputStream in)
        throws IOException
    {
        try (InputStream stream = in) {
            byte[] head = ByteStreams.toByteArray(ByteStreams.limit(stream, maxOutputBytes));
            long dropped = ByteStreams.exhaust(stream);
            String text = new String(head, StandardCharsets.UTF_8);
            if (dropped > 0) {
                text += "\n... (" + dropped + " bytes truncated)";
            }
            return text;
        }
    }

    private static Optional<String> collect(Future<String> output)
        throws InterruptedException
    {
        try {
            String text = output.get(5, SECONDS);
            return text.isEmpty() ? Optional.absent() : Optional.of(text);
        }
        catch (ExecutionException | TimeoutException ex) {
            logger.warn("Failed to read script output", ex);
            output.cancel(true);
            return Optional.absent();
        }
    }
}
