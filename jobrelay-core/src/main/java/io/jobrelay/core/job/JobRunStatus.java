package io.jobrelay.core.job;

public enum JobRunStatus
{
    RUNNING,
    SUCCESS,
    FAILED;
}
