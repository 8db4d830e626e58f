package io.jobrelay.core.chain;

public enum JobDeletion
{
    DELETED,

    // another job still lists it as a dependent. the job is disabled instead.
    SOFT_DELETED;
}
