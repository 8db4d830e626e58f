package io.jobrelay.server;

import java.util.Set;
import javax.ws.rs.core.Application;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import com.google.inject.name.Named;

/**
 * JAX-RS application whose resources and providers are instances built by Guice.
 */
public class JobRelayApplication
        extends Application
{
    public static final String JAXRS_SINGLETONS = "jobrelay.jaxrs.singletons";

    private final Set<Object> singletons;

    @Inject
    public JobRelayApplication(@Named(JAXRS_SINGLETONS) Set<Object> singletons)
    {
        this.singletons = ImmutableSet.copyOf(singletons);
    }

    @Override
    public Set<Object> getSingletons()
    {
        return singletons;
    }
}
