package io.jobrelay.core.notification;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.spi.Notification;
import io.jobrelay.spi.NotificationException;
import io.jobrelay.spi.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.ProcessBuilder.Redirect.PIPE;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Pipes the notification as JSON into notification.shell.command.
 */
public class ShellNotificationSender
        implements NotificationSender
{
    private static final Logger logger = LoggerFactory.getLogger(ShellNotificationSender.class);

    private static final String NOTIFICATION_SHELL_COMMAND = "notification.shell.command";
    private static final String NOTIFICATION_SHELL_TIMEOUT = "notification.shell.timeout";
    private static final int NOTIFICATION_SHELL_TIMEOUT_DEFAULT = 30_000;

    private final String command;
    private final ObjectMapper mapper;
    private final int timeoutMs;

    @Inject
    public ShellNotificationSender(Config systemConfig, ObjectMapper mapper)
    {
        this.command = systemConfig.get(NOTIFICATION_SHELL_COMMAND, String.class);
        this.mapper = mapper;
        this.timeoutMs = systemConfig.get(NOTIFICATION_SHELL_TIMEOUT, int.class, NOTIFICATION_SHELL_TIMEOUT_DEFAULT);
    }

    @Override
    public void sendNotification(Notification notification)
            throws NotificationException
    {
        byte[] notificationJson;
        try {
            notificationJson = mapper.writeValueAsBytes(notification);
        }
        catch (JsonProcessingException e) {
            throw new NotificationException("Failed to serialize notification of job id=" + notification.getJobId(), e);
        }

        ExecutorService writer = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("notification-writer-%d")
                .build());

        File devNull = new File("/dev/null");

        ProcessBuilder processBuilder = new ProcessBuilder()
                .redirectOutput(devNull)
                .redirectError(devNull)
                .redirectInput(PIPE)
                .command("/bin/sh", "-c", command);

        try {
            Process process = processBuilder.start();

            writer.execute(() -> {
                try (OutputStream stream = process.getOutputStream()) {
                    stream.write(notificationJson);
                    stream.flush();
                }
                catch (IOException e) {
                    logger.warn("Failed to write notification to shell command: {}", command, e);
                }
            });

            boolean exited = process.waitFor(timeoutMs, MILLISECONDS);
            if (!exited) {
                process.destroyForcibly();
                throw new NotificationException("Notification shell command timed out: " + command);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new NotificationException("Notification shell command failed: " + command + ", exit code = " + exitCode);
            }
        }
        catch (IOException e) {
            throw new NotificationException("Failed to execute notification shell command: " + command, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while running notification shell command: " + command, e);
        }
        finally {
            writer.shutdown();
        }
    }
}
