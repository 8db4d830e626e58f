package io.jobrelay.core.job;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.jobrelay.core.watch.FileWatchState;
import io.jobrelay.core.watch.SelfTouchPolicy;
import io.jobrelay.core.watch.StoredFileWatchState;

public class JobModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(JobStore.class).to(MemoryJobStore.class).in(Scopes.SINGLETON);
        binder.bind(FileWatchState.class).to(StoredFileWatchState.class).in(Scopes.SINGLETON);
        binder.bind(SelfTouchPolicy.class).in(Scopes.SINGLETON);
        binder.bind(JobManager.class).in(Scopes.SINGLETON);
    }
}
