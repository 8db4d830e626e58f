package io.jobrelay.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    public static Path defaultConfigPath(Map<String, String> env)
    {
        return jobrelayConfigHome(env).resolve("config");
    }

    public static Path jobrelayConfigHome(Map<String, String> env)
    {
        String home = env.get("JOBRELAY_CONFIG_HOME");
        if (home != null) {
            return Paths.get(home);
        }
        return configHome(env).resolve("jobrelay");
    }

    private static Path configHome(Map<String, String> env)
    {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null) {
            return Paths.get(configHome);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }
}
