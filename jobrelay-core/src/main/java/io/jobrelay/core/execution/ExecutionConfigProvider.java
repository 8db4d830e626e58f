package io.jobrelay.core.execution;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.jobrelay.client.config.Config;

public class ExecutionConfigProvider
    implements Provider<ExecutionConfig>
{
    private final ExecutionConfig config;

    @Inject
    public ExecutionConfigProvider(Config systemConfig)
    {
        this.config = ExecutionConfig.convertFrom(systemConfig);
    }

    @Override
    public ExecutionConfig get()
    {
        return config;
    }
}
