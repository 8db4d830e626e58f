package io.jobrelay.standards.scheduler;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.jobrelay.spi.SchedulerFactory;

public class SchedulerModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        addStandardSchedulerFactory(binder, CronSchedulerFactory.class);
        addStandardSchedulerFactory(binder, DailySchedulerFactory.class);
        addStandardSchedulerFactory(binder, IntervalSchedulerFactory.class);
        addStandardSchedulerFactory(binder, MinutesIntervalSchedulerFactory.class);
        binder.bind(ScheduleConfigHelper.class).in(Scopes.SINGLETON);
    }

    protected void addStandardSchedulerFactory(Binder binder, Class<? extends SchedulerFactory> factory)
    {
        Multibinder.newSetBinder(binder, SchedulerFactory.class)
            .addBinding().to(factory).in(Scopes.SINGLETON);
    }
}
