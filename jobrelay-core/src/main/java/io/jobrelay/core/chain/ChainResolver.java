package io.jobrelay.core.chain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.jobrelay.client.config.Config;
import io.jobrelay.core.execution.ExecutionCoordinator;
import io.jobrelay.core.execution.Trigger;
import io.jobrelay.core.execution.TriggerResult;
import io.jobrelay.core.job.JobControl;
import io.jobrelay.core.job.JobStore;
import io.jobrelay.core.job.StoredJob;
import io.jobrelay.core.repository.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the dependency edges between jobs.
 * <p>
 * Edges are checked for cycles when they are added. Propagation trusts the
 * graph and only walks one level: a dependent's own dependents run when the
 * dependent completes.
 */
public class ChainResolver
{
    private static final Logger logger = LoggerFactory.getLogger(ChainResolver.class);

    private final JobStore store;
    private final Provider<ExecutionCoordinator> coordinator;
    private final ChainPolicy policy;

    // serializes edge changes with each other and with deletion
    private final Object edgeLock = new Object();

    @Inject
    public ChainResolver(JobStore store, Provider<ExecutionCoordinator> coordinator, Config systemConfig)
    {
        this(store, coordinator, ChainPolicy.fromString(systemConfig.get("chain.policy", String.class, "always")));
    }

    @VisibleForTesting
    public ChainResolver(JobStore store, Provider<ExecutionCoordinator> coordinator, ChainPolicy policy)
    {
        this.store = store;
        this.coordinator = coordinator;
        this.policy = policy;
    }

    public ChainPolicy getPolicy()
    {
        return policy;
    }

    /**
     * Triggers the dependents of a job that just completed.
     *
     * @return result of each dependent that was triggered
     */
    public Map<Long, TriggerResult> onComplete(long jobId, boolean succeeded)
    {
        StoredJob job;
        try {
            job = store.getJobById(jobId);
        }
        catch (ResourceNotFoundException ex) {
            logger.debug("Job id={} was deleted. Nothing to chain.", jobId);
            return ImmutableMap.of();
        }

        if (job.getDependents().isEmpty()) {
            return ImmutableMap.of();
        }
        if (!policy.shouldPropagate(succeeded)) {
            logger.info("Job id={} failed. Skipping its {} dependents because chain.policy is success_only",
                    jobId, job.getDependents().size());
            return ImmutableMap.of();
        }

        Map<Long, TriggerResult> results = new LinkedHashMap<>();
        for (long dependentId : job.getDependents()) {
            try {
                TriggerResult result = coordinator.get().execute(dependentId, Trigger.completion(jobId, succeeded));
                logger.debug("Completion of job id={} triggered job id={}: {}", jobId, dependentId, result.getStatus());
                results.put(dependentId, result);
            }
            catch (ResourceNotFoundException ex) {
                logger.warn("Dependent job id={} of job id={} does not exist. Skipping.", dependentId, jobId);
            }
            catch (RuntimeException ex) {
                logger.error("Failed to trigger dependent job id={} of job id={}", dependentId, jobId, ex);
            }
        }
        return results;
    }

    /**
     * Adds an edge so that childId runs whenever parentId completes.
     *
     * @throws DependencyCycleException if childId already reaches parentId
     */
    public void addDependent(long parentId, long childId)
        throws ResourceNotFoundException, DependencyCycleException
    {
        synchronized (edgeLock) {
            store.getJobById(childId);
            if (parentId == childId || isReachable(childId, parentId)) {
                throw new DependencyCycleException(parentId, childId);
            }
            store.updateJobById(parentId, (controlStore, parent) -> {
                controlStore.addDependent(parentId, childId);
                return null;
            });
        }
        logger.info("Job id={} now triggers job id={} on completion", parentId, childId);
    }

    public void removeDependent(long parentId, long childId)
        throws ResourceNotFoundException
    {
        synchronized (edgeLock) {
            store.updateJobById(parentId, (controlStore, parent) -> {
                if (!parent.getDependents().contains(childId)) {
                    throw new ResourceNotFoundException("Job id=" + childId + " is not a dependent of job id=" + parentId);
                }
                controlStore.removeDependent(parentId, childId);
                return null;
            });
        }
        logger.info("Removed dependency edge {} -> {}", parentId, childId);
    }

    /**
     * Deletes a job, or only disables it while another job lists it as a dependent.
     */
    public JobDeletion deleteOrDisable(long jobId)
        throws ResourceNotFoundException
    {
        synchronized (edgeLock) {
            List<StoredJob> parents = store.getParents(jobId);
            if (!parents.isEmpty()) {
                store.updateJobById(jobId, (controlStore, job) -> {
                    new JobControl(controlStore, job).disableJob();
                    return null;
                });
                logger.info("Job id={} is a dependent of {} jobs. Disabled it instead of deleting.", jobId, parents.size());
                return JobDeletion.SOFT_DELETED;
            }
            store.deleteJobById(jobId);
            logger.info("Deleted job id={}", jobId);
            return JobDeletion.DELETED;
        }
    }

    // breadth first walk over dependents edges
    @VisibleForTesting
    boolean isReachable(long fromId, long targetId)
    {
        Set<Long> visited = new HashSet<>();
        Deque<Long> queue = new ArrayDeque<>();
        queue.add(fromId);
        while (!queue.isEmpty()) {
            long id = queue.poll();
            if (id == targetId) {
                return true;
            }
            if (!visited.add(id)) {
                continue;
            }
            try {
                queue.addAll(store.getJobById(id).getDependents());
            }
            catch (ResourceNotFoundException ex) {
                // dangling edge to a deleted job
                continue;
            }
        }
        return false;
    }
}
