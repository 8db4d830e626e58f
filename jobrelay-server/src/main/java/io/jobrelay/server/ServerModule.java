package io.jobrelay.server;

import javax.ws.rs.NotSupportedException;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.Response;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.jaxrs.json.JacksonJsonProvider;
import com.google.inject.AbstractModule;
import com.google.inject.Inject;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import com.google.inject.name.Names;
import io.jobrelay.client.config.ConfigException;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceConflictException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.core.repository.StoreUnavailableException;
import io.jobrelay.server.rs.JobResource;
import io.jobrelay.server.rs.TriggerResource;

public class ServerModule
        extends AbstractModule
{
    private final ServerConfig serverConfig;

    public ServerModule(ServerConfig serverConfig)
    {
        this.serverConfig = serverConfig;
    }

    @Override
    public void configure()
    {
        binder().bind(ServerConfig.class).toInstance(serverConfig);
        binder().bind(JobRelayApplication.class).in(Scopes.SINGLETON);

        Multibinder<Object> application = Multibinder.newSetBinder(binder(), Object.class, Names.named(JobRelayApplication.JAXRS_SINGLETONS));
        application.addBinding().toProvider(JsonProviderProvider.class).in(Scopes.SINGLETON);
        bindResources(application);
        bindExceptionhandlers(application);
    }

    protected void bindResources(Multibinder<Object> application)
    {
        binder().bind(JobResource.class).in(Scopes.SINGLETON);
        binder().bind(TriggerResource.class).in(Scopes.SINGLETON);
        application.addBinding().to(JobResource.class);
        application.addBinding().to(TriggerResource.class);
    }

    protected void bindExceptionhandlers(Multibinder<Object> application)
    {
        int retryAfter = serverConfig.getRetryAfterSeconds();
        application.addBinding().toInstance(new GenericJsonExceptionHandler<AccessDeniedException>(Response.Status.FORBIDDEN) { });
        application.addBinding().toInstance(new GenericJsonExceptionHandler<ResourceNotFoundException>(Response.Status.NOT_FOUND) { });
        application.addBinding().toInstance(new GenericJsonExceptionHandler<ResourceConflictException>(Response.Status.CONFLICT) { });
        application.addBinding().toInstance(new GenericJsonExceptionHandler<NotSupportedException>(Response.Status.BAD_REQUEST) { });
        application.addBinding().toInstance(new GenericJsonExceptionHandler<ConfigException>(Response.Status.BAD_REQUEST) { });
        application.addBinding().toInstance(new GenericJsonExceptionHandler<IllegalArgumentException>(Response.Status.BAD_REQUEST) { });
        application.addBinding().toInstance(new GenericJsonExceptionHandler<StoreUnavailableException>(Response.Status.SERVICE_UNAVAILABLE) {
            @Override
            public Response toResponse(StoreUnavailableException exception)
            {
                return responseBuilder(Response.Status.SERVICE_UNAVAILABLE.getStatusCode(), exception.getMessage())
                    .header(HttpHeaders.RETRY_AFTER, retryAfter)
                    .build();
            }
        });
    }

    public static class JsonProviderProvider
            implements com.google.inject.Provider<JacksonJsonProvider>
    {
        private final ObjectMapper mapper;

        @Inject
        public JsonProviderProvider(ObjectMapper mapper)
        {
            this.mapper = mapper.copy();
            this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }

        @Override
        public JacksonJsonProvider get()
        {
            return new JacksonJsonProvider(mapper);
        }
    }
}
