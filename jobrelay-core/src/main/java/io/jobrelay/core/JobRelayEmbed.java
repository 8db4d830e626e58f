package io.jobrelay.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.TypeLiteral;
import com.google.inject.util.Modules;
import io.jobrelay.client.api.JacksonTimeModule;
import io.jobrelay.client.config.Config;
import io.jobrelay.client.config.ConfigElement;
import io.jobrelay.client.config.ConfigFactory;
import io.jobrelay.core.execution.ExecutionModule;
import io.jobrelay.core.job.JobModule;
import io.jobrelay.core.notification.NotificationModule;
import io.jobrelay.core.poll.TriggerPoller;
import io.jobrelay.core.poll.TriggerPollerModule;
import io.jobrelay.core.schedule.ScheduleModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the engine's injector. The HTTP server and tests start from here.
 * <p>
 * A {@link io.jobrelay.spi.ScriptRunner} binding is not part of the standard
 * modules and must be added by the caller.
 */
public class JobRelayEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(JobRelayEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();
        private boolean withTriggerPoller = true;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public Bootstrap withTriggerPoller(boolean v)
        {
            this.withTriggerPoller = v;
            return this;
        }

        public JobRelayEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(modules);

            JobRelayEmbed embed = new JobRelayEmbed(injector);
            if (withTriggerPoller) {
                injector.getInstance(TriggerPoller.class).start();
            }
            return embed;
        }

        private List<Module> standardModules(ConfigElement systemConfig)
        {
            ImmutableList.Builder<Module> builder = ImmutableList.builder();
            if (withTriggerPoller) {
                // registered first so that close() stops polling before the workers
                builder.add(new TriggerPollerModule());
            }
            builder.addAll(Arrays.asList(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JacksonTimeModule()),
                    new ScheduleModule(),
                    new JobModule(),
                    new ExecutionModule(),
                    new NotificationModule(),
                    (binder) -> {
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
                    }
                ));
            return builder.build();
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;

    JobRelayEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    @Override
    public void close()
    {
        Set<BackgroundExecutor> executors = injector.getInstance(Key.get(new TypeLiteral<Set<BackgroundExecutor>>() {}));
        for (BackgroundExecutor executor : executors) {
            try {
                executor.eagerShutdown();
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while shutting down {}", executor.getClass().getSimpleName());
            }
            catch (Exception ex) {
                logger.error("Failed to shut down {}", executor.getClass().getSimpleName(), ex);
            }
        }
    }
}
