package io.jobrelay.server;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.inject.Module;
import io.jobrelay.core.JobRelayEmbed;
import io.undertow.Undertow;
import io.undertow.servlet.api.DeploymentInfo;
import org.jboss.resteasy.plugins.server.undertow.UndertowJaxrsServer;
import org.jboss.resteasy.spi.ResteasyDeployment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the engine and serves its HTTP API on undertow.
 */
public class ServerBootstrap
{
    private static final Logger logger = LoggerFactory.getLogger(ServerBootstrap.class);

    protected final ServerConfig serverConfig;
    private final List<Module> extensionModules;

    public ServerBootstrap(ServerConfig serverConfig, List<Module> extensionModules)
    {
        this.serverConfig = serverConfig;
        this.extensionModules = ImmutableList.copyOf(extensionModules);
    }

    protected JobRelayEmbed.Bootstrap embedBootstrap()
    {
        return new JobRelayEmbed.Bootstrap()
            .setSystemConfig(serverConfig.getSystemConfig())
            .addModules(extensionModules)
            .addModules(new ServerModule(serverConfig));
    }

    public static ServerControl start(ServerBootstrap bootstrap)
    {
        ServerControl control = bootstrap.startServer();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            control.stop();
            logger.info("Shutdown completed");
        }, "shutdown"));

        return control;
    }

    ServerControl startServer()
    {
        JobRelayEmbed embed = embedBootstrap().initialize();
        try {
            ResteasyDeployment deployment = new ResteasyDeployment();
            deployment.setApplication(embed.getInjector().getInstance(JobRelayApplication.class));

            UndertowJaxrsServer server = new UndertowJaxrsServer();
            DeploymentInfo deploymentInfo = server.undertowDeployment(deployment, "/")
                .setClassLoader(ServerBootstrap.class.getClassLoader())
                .setContextPath("/")
                .setDeploymentName("jobrelay");
            server.deploy(deploymentInfo);
            server.start(Undertow.builder().addHttpListener(serverConfig.getPort(), serverConfig.getBind()));

            logger.info("Started jobrelay server at http://{}:{}", serverConfig.getBind(), serverConfig.getPort());
            return new ServerControl(embed, server);
        }
        catch (RuntimeException ex) {
            embed.close();
            throw ex;
        }
    }
}
