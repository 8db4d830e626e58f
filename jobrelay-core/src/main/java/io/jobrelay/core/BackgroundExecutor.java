package io.jobrelay.core;

/**
 * A component owning threads. {@link JobRelayEmbed#close()} shuts down all of them.
 */
public interface BackgroundExecutor
{
    void eagerShutdown() throws Exception;
}
