package io.jobrelay.core.repository;

/**
 * An exception thrown when a change conflicts with the current state, such as
 * a duplicated job name or a dependency edge that would close a cycle.
 *
 * This exception is deterministic.
 */
public class ResourceConflictException extends Exception
{
    public ResourceConflictException(String message)
    {
        super(message);
    }

    public ResourceConflictException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
