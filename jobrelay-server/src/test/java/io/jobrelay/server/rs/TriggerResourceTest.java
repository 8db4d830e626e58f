package io.jobrelay.server.rs;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.Response;
import com.google.common.base.Optional;
import io.jobrelay.client.api.RestJob;
import io.jobrelay.client.api.RestJobRequest;
import io.jobrelay.client.api.RestTriggerResult;
import io.jobrelay.core.JobRelayEmbed;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.spi.ScriptResult;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.jobrelay.server.ServerTestUtils.embed;
import static io.jobrelay.server.ServerTestUtils.newConfig;
import static io.jobrelay.server.ServerTestUtils.waitForRun;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;

public class TriggerResourceTest
{
    private JobRelayEmbed embed;
    private JobResource jobs;
    private TriggerResource triggers;
    private JobStore store;

    @Before
    public void setUp()
    {
        embed = embed(newConfig().set("webhook.secret", "shared"));
        jobs = embed.getInjector().getInstance(JobResource.class);
        triggers = embed.getInjector().getInstance(TriggerResource.class);
        store = embed.getInjector().getInstance(JobStore.class);
    }

    @After
    public void tearDown()
    {
        embed.close();
    }

    private long create(String caller, String name, boolean enabled)
            throws Exception
    {
        Response response = jobs.createJob(caller, RestJobRequest.builder()
                .name(name)
                .scriptRef("echo " + name)
                .enabled(enabled)
                .build());
        return ((RestJob) response.getEntity()).getId();
    }

    @Test
    public void manualRunIsAccepted()
            throws Exception
    {
        long id = create("alice", "backup", true);

        Response response = triggers.runJob("alice", id);

        assertThat(response.getStatus(), is(202));
        RestTriggerResult result = (RestTriggerResult) response.getEntity();
        assertThat(result.getResult(), is("ACCEPTED"));
        assertThat(result.getRunId().isPresent(), is(true));
        assertThat(waitForRun(store, id).getRunId(), is(result.getRunId().get()));
    }

    @Test
    public void disabledJobIsNoop()
            throws Exception
    {
        long id = create("alice", "backup", false);

        Response response = triggers.runJob("alice", id);

        assertThat(response.getStatus(), is(200));
        assertThat(((RestTriggerResult) response.getEntity()).getResult(), is("DISABLED"));
        assertThat(store.getRuns(id, 10).isEmpty(), is(true));
        assertThat(store.getTriggerEvents(id, 10).size(), is(1));
    }

    @Test(expected = AccessDeniedException.class)
    public void manualRunByOtherCaller()
            throws Exception
    {
        long id = create("alice", "backup", true);
        triggers.runJob("bob", id);
    }

    @Test(expected = ResourceNotFoundException.class)
    public void missingJob()
            throws Exception
    {
        triggers.runJob("alice", 9999);
    }

    @Test
    public void webhookWithSharedSecretInHeader()
            throws Exception
    {
        long id = create("alice", "backup", true);

        Response response = triggers.webhook(id, "shared", null);

        assertThat(response.getStatus(), is(202));
        waitForRun(store, id);
    }

    @Test
    public void webhookWithSecretInQuery()
            throws Exception
    {
        long id = create("alice", "backup", true);

        assertThat(triggers.webhook(id, null, "shared").getStatus(), is(202));
        waitForRun(store, id);
    }

    @Test
    public void webhookJobSecretOverridesSharedSecret()
            throws Exception
    {
        Response created = jobs.createJob("alice", RestJobRequest.builder()
                .name("deploy")
                .scriptRef("deploy.sh")
                .webhookSecret("only-for-deploy")
                .build());
        long id = ((RestJob) created.getEntity()).getId();

        try {
            triggers.webhook(id, "shared", null);
            fail();
        }
        catch (AccessDeniedException expected) {
        }
        assertThat(triggers.webhook(id, "only-for-deploy", null).getStatus(), is(202));
        waitForRun(store, id);
    }

    @Test(expected = AccessDeniedException.class)
    public void webhookWithoutSecret()
            throws Exception
    {
        long id = create("alice", "backup", true);
        triggers.webhook(id, null, null);
    }

    @Test
    public void command()
            throws Exception
    {
        long id = create("alice", "backup", true);

        assertThat(triggers.command("alice", "/job list").getReply(), startsWith(id + " backup"));
        assertThat(triggers.command("alice", "/job run " + id).getReply(), startsWith("Started job " + id));
        waitForRun(store, id);
        assertThat(triggers.command("bob", "/job run " + id).getReply(), is("No such job: " + id));
    }

    @Test
    public void commandRequiresCaller()
    {
        try {
            triggers.command("", "/job list");
            fail();
        }
        catch (WebApplicationException ex) {
            assertThat(ex.getResponse().getStatus(), is(401));
        }
    }

    @Test
    public void rejectedRunAsksToRetry()
            throws Exception
    {
        embed.close();

        // one worker and no queue. the second job is rejected while the first one runs
        CountDownLatch release = new CountDownLatch(1);
        embed = embed(newConfig()
                    .set("executor.max_concurrent", 1)
                    .set("executor.queue_capacity", 0)
                    .set("server.retry_after", 7),
                request -> {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    }
                    catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                    return ScriptResult.succeeded(Optional.absent());
                });
        jobs = embed.getInjector().getInstance(JobResource.class);
        triggers = embed.getInjector().getInstance(TriggerResource.class);
        store = embed.getInjector().getInstance(JobStore.class);

        long first = create("alice", "first", true);
        long second = create("alice", "second", true);

        try {
            assertThat(triggers.runJob("alice", first).getStatus(), is(202));
            Response response = triggers.runJob("alice", second);

            assertThat(response.getStatus(), is(503));
            assertThat(response.getHeaderString(HttpHeaders.RETRY_AFTER), is("7"));
            RestTriggerResult result = (RestTriggerResult) response.getEntity();
            assertThat(result.getResult(), is("REJECTED"));
            assertThat(result.getRetryable(), is(true));
        }
        finally {
            release.countDown();
        }
        waitForRun(store, first);
        assertThat(store.getRuns(second, 10).isEmpty(), is(true));
    }
}
