package io.jobrelay.core.dispatch;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.jobrelay.client.config.Config;
import io.jobrelay.core.execution.ExecutionCoordinator;
import io.jobrelay.core.execution.Trigger;
import io.jobrelay.core.execution.TriggerResult;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.job.TriggerEvent;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import io.jobrelay.spi.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of triggers arriving from outside the engine: webhooks, manual
 * runs and conversational commands.
 * <p>
 * Each call checks that the job exists and that the caller may trigger it,
 * records a {@link TriggerEvent}, then hands the trigger to
 * {@link ExecutionCoordinator}. Disabled jobs are accepted as a no-op.
 */
public class EventDispatcher
{
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final JobStore store;
    private final ExecutionCoordinator coordinator;
    private final Optional<String> sharedWebhookSecret;

    @Inject
    public EventDispatcher(JobStore store, ExecutionCoordinator coordinator, Config systemConfig)
    {
        this(store, coordinator, systemConfig.getOptional("webhook.secret", String.class));
    }

    @VisibleForTesting
    public EventDispatcher(JobStore store, ExecutionCoordinator coordinator, Optional<String> sharedWebhookSecret)
    {
        this.store = store;
        this.coordinator = coordinator;
        this.sharedWebhookSecret = sharedWebhookSecret;
    }

    /**
     * Triggers a job from a webhook. The presented secret must match the job's
     * own secret, or the server-wide secret when the job has none.
     */
    public TriggerResult webhook(long jobId, Optional<String> presentedSecret)
        throws ResourceNotFoundException, AccessDeniedException
    {
        StoredJob job = store.getJobById(jobId);

        Optional<String> expected = job.getWebhookSecret().or(sharedWebhookSecret);
        if (!expected.isPresent()) {
            logger.warn("Rejected webhook for job id={}: no webhook secret is configured", jobId);
            throw new AccessDeniedException("Webhook is not configured for job id=" + jobId);
        }
        if (!presentedSecret.isPresent() || !secretEquals(expected.get(), presentedSecret.get())) {
            logger.warn("Rejected webhook for job id={}: invalid secret", jobId);
            throw new AccessDeniedException("Invalid webhook secret for job id=" + jobId);
        }

        return forward(job, Trigger.webhook(), Optional.absent());
    }

    /**
     * Triggers a job on behalf of its owner, e.g. from the HTTP API.
     */
    public TriggerResult manual(long jobId, String callerId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        StoredJob job = store.getJobById(jobId);
        checkOwner(job, callerId);
        return forward(job, Trigger.manual(callerId), Optional.of(callerId));
    }

    /**
     * Triggers a job from a chat command. The session identity is the caller.
     */
    public TriggerResult conversational(long jobId, String sessionCallerId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        logger.debug("Conversational trigger of job id={} from {}", jobId, sessionCallerId);
        return manual(jobId, sessionCallerId);
    }

    private TriggerResult forward(StoredJob job, Trigger trigger, Optional<String> callerId)
        throws ResourceNotFoundException
    {
        store.putTriggerEvent(TriggerEvent.of(job.getId(), trigger.getSource(), callerId, Instant.now()));
        TriggerResult result = coordinator.execute(job.getId(), trigger);
        if (trigger.getSource() == TriggerSource.WEBHOOK) {
            logger.info("Webhook trigger of job id={}: {}", job.getId(), result.getStatus());
        }
        else {
            logger.info("Manual trigger of job id={} by {}: {}", job.getId(), callerId.orNull(), result.getStatus());
        }
        return result;
    }

    static void checkOwner(StoredJob job, String callerId)
        throws AccessDeniedException
    {
        if (!job.getOwnerId().equals(callerId)) {
            logger.warn("Rejected trigger of job id={} by {}: not the owner", job.getId(), callerId);
            throw new AccessDeniedException("Job id=" + job.getId() + " is not owned by " + callerId);
        }
    }

    private static boolean secretEquals(String expected, String presented)
    {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
