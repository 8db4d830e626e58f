package io.jobrelay.core.dispatch;

import java.util.List;
import com.google.common.base.Splitter;
import com.google.inject.Inject;
import io.jobrelay.core.execution.TriggerResult;
import io.jobrelay.core.job.JobManager;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.repository.AccessDeniedException;
import io.jobrelay.core.repository.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers chat commands such as "/job run 12". Replies are plain text and
 * failures are reported in the reply, never thrown.
 */
public class JobCommandHandler
{
    private static final Logger logger = LoggerFactory.getLogger(JobCommandHandler.class);

    static final String USAGE = String.join("\n",
            "Usage:",
            "  /job list          list your jobs",
            "  /job run <id>      run a job now",
            "  /job enable <id>   enable a job",
            "  /job disable <id>  disable a job",
            "  /job help          show this message");

    private static final Splitter WORDS = Splitter.on(' ').trimResults().omitEmptyStrings();

    private final EventDispatcher dispatcher;
    private final JobManager jobManager;

    @Inject
    public JobCommandHandler(EventDispatcher dispatcher, JobManager jobManager)
    {
        this.dispatcher = dispatcher;
        this.jobManager = jobManager;
    }

    public String handle(String callerId, String text)
    {
        List<String> words = WORDS.splitToList(text.trim());
        if (words.isEmpty() || !words.get(0).equals("/job")) {
            return USAGE;
        }
        if (words.size() < 2) {
            return USAGE;
        }

        String command = words.get(1);
        try {
            switch (command) {
            case "list":
                return list(callerId);
            case "run":
                return run(callerId, parseJobId(words));
            case "enable":
                StoredJob enabled = jobManager.enableJob(callerId, parseJobId(words));
                return String.format("Enabled job %d '%s'", enabled.getId(), enabled.getName());
            case "disable":
                StoredJob disabled = jobManager.disableJob(callerId, parseJobId(words));
                return String.format("Disabled job %d '%s'", disabled.getId(), disabled.getName());
            case "help":
            default:
                return USAGE;
            }
        }
        catch (IllegalArgumentException ex) {
            return ex.getMessage();
        }
        catch (ResourceNotFoundException | AccessDeniedException ex) {
            // same reply for a job owned by someone else
            return "No such job: " + words.get(2);
        }
        catch (RuntimeException ex) {
            logger.error("Failed to handle command '{}' from {}", text, callerId, ex);
            return "Command failed. Please try again later.";
        }
    }

    private String list(String callerId)
    {
        List<StoredJob> jobs = jobManager.getJobs(callerId);
        if (jobs.isEmpty()) {
            return "You have no jobs.";
        }
        StringBuilder sb = new StringBuilder();
        for (StoredJob job : jobs) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(job.getId()).append(' ').append(job.getName());
            if (!job.getEnabled()) {
                sb.append(" (disabled)");
            }
            else if (job.getDueTime().isPresent()) {
                sb.append(" next: ").append(job.getDueTime().get());
            }
        }
        return sb.toString();
    }

    private String run(String callerId, long jobId)
        throws ResourceNotFoundException, AccessDeniedException
    {
        TriggerResult result = dispatcher.conversational(jobId, callerId);
        switch (result.getStatus()) {
        case ACCEPTED:
            return String.format("Started job %d (run %s)", jobId, result.getRunId().get());
        case ALREADY_RUNNING:
            return String.format("Job %d is already running", jobId);
        case DISABLED:
            return String.format("Job %d is disabled", jobId);
        case REJECTED:
        default:
            return "Too many jobs are running. Please try again later.";
        }
    }

    private static long parseJobId(List<String> words)
    {
        if (words.size() < 3) {
            throw new IllegalArgumentException("Job id is required. " + USAGE);
        }
        try {
            return Long.parseLong(words.get(2));
        }
        catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid job id: " + words.get(2));
        }
    }
}
