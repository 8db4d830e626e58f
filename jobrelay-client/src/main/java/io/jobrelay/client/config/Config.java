package io.jobrelay.client.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;
import io.jobrelay.client.Durations;

import static java.util.Locale.ENGLISH;

/**
 * Mutable, JSON backed parameter bag.
 * <p>
 * Holds the system configuration (flat dotted keys read from a properties
 * file) and job level parameters such as recurrence rules. Typed reads fail
 * with a {@link ConfigException} that names the key.
 */
public class Config
{
    private static final Map<Class<?>, String> TYPE_NAMES = ImmutableMap.<Class<?>, String>builder()
        .put(String.class, "string type")
        .put(int.class, "integer (int) type")
        .put(Integer.class, "integer (int) type")
        .put(long.class, "integer (long) type")
        .put(Long.class, "integer (long) type")
        .put(boolean.class, "'true' or 'false'")
        .put(Boolean.class, "'true' or 'false'")
        .build();

    private static final int SAMPLE_LENGTH = 100;

    final ObjectMapper mapper;
    final ObjectNode object;

    Config(ObjectMapper mapper)
    {
        this(mapper, JsonNodeFactory.instance.objectNode());
    }

    Config(ObjectMapper mapper, JsonNode object)
    {
        this.mapper = mapper;
        this.object = (ObjectNode) object;
    }

    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode object)
    {
        if (!object.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + object);
        }
        return new Config(mapper, object);
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    /**
     * Stores the value under key, or removes the key if value is null.
     */
    public Config set(String key, Object value)
    {
        if (value == null) {
            return remove(key);
        }
        if (value instanceof JsonNode) {
            object.set(key, (JsonNode) value);
            return this;
        }
        try {
            object.set(key, mapper.valueToTree(value));
        }
        catch (IllegalArgumentException ex) {
            throw new ConfigException("Unable to store value of " + value.getClass() + " for key '" + key + "'", ex);
        }
        return this;
    }

    public Config remove(String key)
    {
        object.remove(key);
        return this;
    }

    public Config deepCopy()
    {
        return new Config(mapper, object.deepCopy());
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public <E> E get(String key, Class<E> type)
    {
        return Primitives.wrap(type).cast(read(key, requireValue(key), constructType(type)));
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        Optional<JsonNode> value = lookup(key);
        if (!value.isPresent()) {
            return defaultValue;
        }
        return Primitives.wrap(type).cast(read(key, value.get(), constructType(type)));
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        Optional<JsonNode> value = lookup(key);
        if (!value.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(Primitives.wrap(type).cast(read(key, value.get(), constructType(type))));
    }

    /**
     * Reads a duration written either as a number of seconds ({@code 90}) or
     * as a duration expression ({@code "1m 30s"}).
     */
    public Duration getDuration(String key, Duration defaultValue)
    {
        Optional<JsonNode> value = lookup(key);
        if (!value.isPresent()) {
            return defaultValue;
        }
        JsonNode node = value.get();
        if (node.isIntegralNumber()) {
            return Duration.ofSeconds(node.longValue());
        }
        String text = node.asText().trim();
        try {
            if (text.chars().allMatch(Character::isDigit) && !text.isEmpty()) {
                return Duration.ofSeconds(Long.parseLong(text));
            }
            return Durations.parseDuration(text);
        }
        catch (DateTimeParseException | NumberFormatException ex) {
            throw new ConfigException(String.format(ENGLISH,
                        "Expected duration such as '30s' or '10m' for key '%s' but got %s", key, node), ex);
        }
    }

    public Config getNested(String key)
    {
        JsonNode value = requireValue(key);
        if (!value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, value);
    }

    private Optional<JsonNode> lookup(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return Optional.absent();
        }
        return Optional.of(value);
    }

    private JsonNode requireValue(String key)
    {
        JsonNode value = object.get(key);
        if (value == null) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        if (value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but null");
        }
        return value;
    }

    private JavaType constructType(Class<?> type)
    {
        return mapper.getTypeFactory().constructType(type);
    }

    private Object read(String key, JsonNode value, JavaType type)
    {
        try {
            return mapper.readValue(value.traverse(), type);
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, ConfigException.class);
            String typeName = TYPE_NAMES.getOrDefault(type.getRawClass(), type.toString());
            throw new ConfigException(String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                        typeName, key, sample(value), value.getNodeType().toString().toLowerCase(ENGLISH)), ex);
        }
    }

    private static String sample(JsonNode value)
    {
        String json = value.toString();
        return json.length() < SAMPLE_LENGTH ? json : json.substring(0, SAMPLE_LENGTH - 3) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Config && object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
