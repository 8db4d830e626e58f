package io.jobrelay.core.repository;

/**
 * An exception thrown when the caller is not allowed to act on a job: it is
 * not the job's owner, or it did not present the job's webhook secret.
 *
 * This exception is deterministic.
 */
public class AccessDeniedException extends Exception
{
    public AccessDeniedException(String message)
    {
        super(message);
    }
}
