package io.jobrelay.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import com.google.inject.name.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

public abstract class Command
{
    private static final Logger logger = LoggerFactory.getLogger(Command.class);

    @Inject @Named(Main.ENVIRONMENT) protected Map<String, String> env;
    @Inject @Named(Main.PROGRAM_NAME) protected String programName;
    @Inject @Named(Main.STDOUT) protected PrintStream out;
    @Inject @Named(Main.STDERR) protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    /**
     * Loads the system configuration. Later sources win:
     * the default config file (only without --config), the JOBRELAY_CONFIG
     * environment variable, JVM system properties, then the --config file.
     */
    protected Properties loadSystemProperties()
        throws IOException
    {
        Properties props = new Properties();

        if (configPath == null) {
            Path defaultConfigPath = ConfigUtil.defaultConfigPath(env);
            try {
                props.putAll(loadFile(defaultConfigPath));
            }
            catch (NoSuchFileException ex) {
                logger.trace("Configuration file not found: {}", defaultConfigPath, ex);
            }
        }

        props.load(new StringReader(env.getOrDefault("JOBRELAY_CONFIG", "")));

        for (String name : System.getProperties().stringPropertyNames()) {
            if (isSystemConfigKey(name)) {
                props.setProperty(name, System.getProperty(name));
            }
        }

        if (configPath != null) {
            props.putAll(loadFile(Paths.get(configPath)));
        }

        return props;
    }

    // JVM properties such as java.version are not engine settings
    private static boolean isSystemConfigKey(String name)
    {
        return name.startsWith("server.")
            || name.startsWith("job.")
            || name.startsWith("executor.")
            || name.startsWith("poller.")
            || name.startsWith("schedule.")
            || name.startsWith("chain.")
            || name.startsWith("file_watch.")
            || name.startsWith("script.")
            || name.startsWith("notification.")
            || name.startsWith("webhook.");
    }

    static Properties loadFile(Path path)
        throws IOException
    {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, UTF_8)) {
            props.load(reader);
        }
        return props;
    }
}
