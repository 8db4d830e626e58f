package io.jobrelay.standards.script;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.jobrelay.core.BackgroundExecutor;
import io.jobrelay.spi.ScriptRunner;

public class ScriptRunnerModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ShellScriptRunner.class).in(Scopes.SINGLETON);
        binder.bind(ScriptRunner.class).to(ShellScriptRunner.class);
        Multibinder.newSetBinder(binder, BackgroundExecutor.class).addBinding().to(ShellScriptRunner.class);
    }
}
