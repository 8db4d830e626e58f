package io.jobrelay.core.poll;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.jobrelay.core.BackgroundExecutor;

public class TriggerPollerModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(TriggerPoller.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, BackgroundExecutor.class).addBinding().to(TriggerPoller.class);
    }
}
