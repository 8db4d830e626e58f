package io.jobrelay.standards;

import java.util.List;
import com.google.common.collect.ImmutableList;
import com.google.inject.Module;
import io.jobrelay.standards.scheduler.SchedulerModule;
import io.jobrelay.standards.script.ScriptRunnerModule;

/**
 * Built-in recurrence rules and the shell script runner.
 */
public class StandardsExtension
{
    public List<Module> getModules()
    {
        return ImmutableList.of(
                new SchedulerModule(),
                new ScriptRunnerModule()
                );
    }
}
