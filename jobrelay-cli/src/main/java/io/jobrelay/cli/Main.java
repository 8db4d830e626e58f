package io.jobrelay.cli;

import java.io.PrintStream;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Map;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.ParameterException;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import com.google.inject.name.Names;
import org.slf4j.LoggerFactory;

import static io.jobrelay.cli.ConfigUtil.defaultConfigPath;
import static io.jobrelay.cli.SystemExitException.systemExit;

public class Main
{
    static final String ENVIRONMENT = "jobrelay.cli.environment";
    static final String PROGRAM_NAME = "jobrelay.cli.programName";
    static final String STDOUT = "jobrelay.cli.stdout";
    static final String STDERR = "jobrelay.cli.stderr";

    private static final String DEFAULT_PROGRAM_NAME = "jobrelay";

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.jobrelay.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    @VisibleForTesting
    Injector commandInjector()
    {
        return Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Names.named(ENVIRONMENT)).toInstance(env);
                bind(String.class).annotatedWith(Names.named(PROGRAM_NAME)).toInstance(programName);
                bind(PrintStream.class).annotatedWith(Names.named(STDOUT)).toInstance(out);
                bind(PrintStream.class).annotatedWith(Names.named(STDERR)).toInstance(err);
            }
        });
    }

    protected void addCommands(JCommander jc, Injector injector)
    {
        jc.addCommand("server", injector.getInstance(Server.class));
    }

    public int cli(String... args)
    {
        err.println(new SimpleDateFormat("yyyy-MM-dd HH:mm:ss Z").format(new Date()) + ": jobrelay");
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        JCommander jc = new JCommander();
        jc.setProgramName(programName);
        addCommands(jc, commandInjector());

        // Disable @ expansion
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.hasErrorMessage()) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = ex.getMessage() == null ? "" : ex.getMessage();
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        boolean verbose;

        switch (command.logLevel) {
        case "error":
        case "warn":
        case "info":
            verbose = false;
            break;
        case "debug":
        case "trace":
            verbose = true;
            break;
        default:
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        configureLogging(command.logLevel, command.logPath);

        for (Map.Entry<String, String> pair : command.systemProperties.entrySet()) {
            System.setProperty(pair.getKey(), pair.getValue());
        }

        return verbose;
    }

    private static void configureLogging(String level, String logPath)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback reads these system properties in the XML files
        Level lv = Level.toLevel(level.toUpperCase(), Level.DEBUG);
        System.setProperty("jobrelay.log.level", lv.toString());

        String name;
        if (logPath.equals("-")) {
            name = "/jobrelay/cli/logback-console.xml";
        }
        else {
            System.setProperty("jobrelay.log.path", logPath);
            name = "/jobrelay/cli/logback-file.xml";
        }
        try {
            configurator.doConfigure(Main.class.getResource(name));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    server                             start the job server");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     set a JVM system property");
        err.println("    -c, --config PATH.properties     Configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("");
    }
}
