package io.jobrelay.server;

import com.google.inject.Injector;
import io.jobrelay.core.JobRelayEmbed;
import org.jboss.resteasy.plugins.server.undertow.UndertowJaxrsServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ServerControl
{
    private static final Logger logger = LoggerFactory.getLogger(ServerControl.class);

    private final JobRelayEmbed embed;
    private final UndertowJaxrsServer server;
    private boolean stopped = false;

    ServerControl(JobRelayEmbed embed, UndertowJaxrsServer server)
    {
        this.embed = embed;
        this.server = server;
    }

    public Injector getInjector()
    {
        return embed.getInjector();
    }

    /**
     * Stops accepting requests, then stops the poller and the workers.
     */
    public synchronized void stop()
    {
        if (stopped) {
            return;
        }
        stopped = true;
        logger.info("Stopping HTTP server");
        try {
            server.stop();
        }
        catch (RuntimeException ex) {
            logger.error("Failed to stop HTTP server", ex);
        }
        embed.close();
    }
}
