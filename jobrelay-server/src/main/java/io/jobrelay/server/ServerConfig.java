package io.jobrelay.server;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.jobrelay.client.JobRelayJson;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigElement;
import io.jobrelay.client.config.ConfigFactory;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableServerConfig.class)
public interface ServerConfig
{
    int DEFAULT_PORT = 65433;
    String DEFAULT_BIND = "127.0.0.1";
    int DEFAULT_RETRY_AFTER_SECONDS = 5;

    int getPort();

    String getBind();

    // Retry-After of 503 responses
    int getRetryAfterSeconds();

    ConfigElement getSystemConfig();

    static ImmutableServerConfig.Builder defaultBuilder()
    {
        return ImmutableServerConfig.builder()
            .port(DEFAULT_PORT)
            .bind(DEFAULT_BIND)
            .retryAfterSeconds(DEFAULT_RETRY_AFTER_SECONDS);
    }

    static ServerConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .port(config.get("server.port", int.class, DEFAULT_PORT))
            .bind(config.get("server.bind", String.class, DEFAULT_BIND))
            .retryAfterSeconds(config.get("server.retry_after", int.class, DEFAULT_RETRY_AFTER_SECONDS))
            // keeps server.* keys so that the engine sees the whole system config
            .systemConfig(ConfigElement.copyOf(config))
            .build();
    }

    static ServerConfig convertFrom(ConfigElement configElement)
    {
        return convertFrom(configElement.toConfig(configFactory()));
    }

    static ConfigFactory configFactory()
    {
        return new ConfigFactory(JobRelayJson.objectMapper());
    }
}
