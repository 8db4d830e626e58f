package io.jobrelay.core.execution;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.jobrelay.core.BackgroundExecutor;
import io.jobrelay.core.chain.ChainResolver;
import io.jobrelay.core.dispatch.EventDispatcher;
import io.jobrelay.core.dispatch.JobCommandHandler;

public class ExecutionModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ExecutionConfig.class).toProvider(ExecutionConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(ExecutionCoordinator.class).in(Scopes.SINGLETON);
        binder.bind(ChainResolver.class).in(Scopes.SINGLETON);
        binder.bind(EventDispatcher.class).in(Scopes.SINGLETON);
        binder.bind(JobCommandHandler.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, BackgroundExecutor.class).addBinding().to(ExecutionCoordinator.class);
    }
}
