package io.jobrelay.client.config;

import java.util.Iterator;
import java.util.Map;
import java.util.Properties;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Immutable snapshot of a {@link Config}. Used where a config is shared
 * between threads, such as the system configuration handed to every module.
 */
public class ConfigElement
{
    public static ConfigElement copyOf(Config mutableConfig)
    {
        return new ConfigElement(mutableConfig.object);
    }

    @JsonCreator
    public static ConfigElement of(ObjectNode node)
    {
        return new ConfigElement(node);
    }

    public static ConfigElement empty()
    {
        return new ConfigElement(JsonNodeFactory.instance.objectNode());
    }

    private final ObjectNode object;  // never exposed without a copy

    private ConfigElement(ObjectNode node)
    {
        this.object = node.deepCopy();
    }

    public Config toConfig(ConfigFactory factory)
    {
        return new Config(factory.objectMapper, object.deepCopy());
    }

    public Properties toProperties()
    {
        Properties props = new Properties();
        putRecursively(props, "", object);
        return props;
    }

    private static void putRecursively(Properties props, String keyPrefix, ObjectNode object)
    {
        Iterator<Map.Entry<String, JsonNode>> ite = object.fields();
        while (ite.hasNext()) {
            Map.Entry<String, JsonNode> pair = ite.next();
            JsonNode value = pair.getValue();
            if (value.isObject()) {
                putRecursively(props, keyPrefix + pair.getKey() + ".", (ObjectNode) value);
            }
            else if (value.isTextual()) {
                props.put(keyPrefix + pair.getKey(), value.asText());
            }
            else {
                props.put(keyPrefix + pair.getKey(), value.toString());
            }
        }
    }

    @JsonValue
    public ObjectNode getObjectNode()
    {
        return object;
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof ConfigElement)) {
            return false;
        }
        return object.equals(((ConfigElement) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
