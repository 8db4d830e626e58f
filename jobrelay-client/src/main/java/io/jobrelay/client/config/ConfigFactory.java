package io.jobrelay.client.config;

import java.io.IOException;
import java.util.Map;
import java.util.Properties;
import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper);
    }

    public Config create(Object other)
    {
        return create().set("_", other).getNested("_");
    }

    public Config fromJsonString(String json)
    {
        try {
            return new Config(objectMapper, objectMapper.readTree(json));
        }
        catch (IOException ex) {
            throw new ConfigException(ex);
        }
    }

    /**
     * Builds a flat config out of properties. Keys keep their dots, so
     * "executor.max_concurrent=4" is read back with get("executor.max_concurrent", int.class).
     */
    public Config fromProperties(Properties props)
    {
        Config config = create();
        for (Map.Entry<Object, Object> entry : props.entrySet()) {
            config.set(entry.getKey().toString(), entry.getValue().toString());
        }
        return config;
    }
}
