package io.jobrelay.core.chain;

import io.jobrelay.core.repository.ResourceConflictException;

/**
 * Adding the dependency edge would close a cycle.
 *
 * This exception is deterministic.
 */
public class DependencyCycleException
        extends ResourceConflictException
{
    private final long parentId;
    private final long childId;

    public DependencyCycleException(long parentId, long childId)
    {
        super(String.format("Job id=%d already depends on job id=%d. Adding the edge %d -> %d would create a cycle",
                    parentId, childId, parentId, childId));
        this.parentId = parentId;
        this.childId = childId;
    }

    public long getParentId()
    {
        return parentId;
    }

    public long getChildId()
    {
        return childId;
    }
}
