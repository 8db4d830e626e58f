package io.jobrelay.core.schedule;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.jobrelay.spi.SchedulerFactory;

public class ScheduleModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ScheduleConfig.class).toProvider(ScheduleConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerManager.class).in(Scopes.SINGLETON);
        binder.bind(RecurrenceScheduler.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, SchedulerFactory.class);
    }
}
