package io.jobrelay.cli;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.Parameter;
import com.google.common.annotations.VisibleForTesting;
import io.jobrelay.client.JobRelayJson;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigFactory;
import io.jobrelay.server.ServerBootstrap;
import io.jobrelay.server.ServerConfig;
import io.jobrelay.standards.StandardsExtension;

import static io.jobrelay.cli.SystemExitException.systemExit;
import static io.jobrelay.server.ServerConfig.DEFAULT_BIND;
import static io.jobrelay.server.ServerConfig.DEFAULT_PORT;

public class Server
        extends Command
{
    @Parameter(names = {"-n", "--port"})
    Integer port = null;

    @Parameter(names = {"-b", "--bind"})
    String bind = null;

    @Parameter(names = {"-w", "--workspace"})
    String workspace = null;

    @Parameter(names = {"--max-concurrent"})
    Integer maxConcurrent = null;

    @Parameter(names = {"--disable-poller"})
    boolean disablePoller = false;

    @Parameter(names = {"-p", "--param"}, validateWith = ParameterValidator.class)
    List<String> paramsList = new ArrayList<>();

    @Override
    public void main()
            throws Exception
    {
        if (args.size() != 0) {
            throw usage(null);
        }
        startServer();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " server [options...]");
        err.println("  Options:");
        err.println("    -n, --port PORT                  port number to listen for api clients (default: " + DEFAULT_PORT + ")");
        err.println("    -b, --bind ADDRESS               IP address to listen HTTP clients (default: " + DEFAULT_BIND + ")");
        err.println("    -w, --workspace DIR              directory that holds per-user script workspaces (default: workspace)");
        err.println("        --max-concurrent N           limit number of scripts running at the same time");
        err.println("        --disable-poller             do not fire scheduled and file-watch triggers");
        err.println("    -p, --param KEY=VALUE            overwrites a system config (use multiple times to set many keys)");
        err.println("    -c, --config PATH.properties     server configuration property path");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }

    private void startServer()
            throws IOException
    {
        // returns after the server started. undertow keeps non-daemon threads and a shutdown hook stops it.
        ServerConfig serverConfig = ServerConfig.convertFrom(buildSystemConfig());
        ServerBootstrap.start(buildServerBootstrap(serverConfig));
    }

    @VisibleForTesting
    Config buildSystemConfig()
        throws IOException
    {
        Properties props = loadSystemProperties();

        if (port != null) {
            props.setProperty("server.port", Integer.toString(port));
        }

        if (bind != null) {
            props.setProperty("server.bind", bind);
        }

        if (workspace != null) {
            props.setProperty("script.workspace_root", Paths.get(workspace).toAbsolutePath().toString());
        }

        if (maxConcurrent != null) {
            props.setProperty("executor.max_concurrent", Integer.toString(maxConcurrent));
        }

        if (disablePoller) {
            props.setProperty("poller.enabled", Boolean.toString(false));
        }

        for (Map.Entry<String, String> param : ParameterValidator.toMap(paramsList).entrySet()) {
            props.setProperty(param.getKey(), param.getValue());
        }

        return new ConfigFactory(JobRelayJson.objectMapper()).fromProperties(props);
    }

    protected ServerBootstrap buildServerBootstrap(ServerConfig serverConfig)
    {
        return new ServerBootstrap(serverConfig, new StandardsExtension().getModules());
    }
}
