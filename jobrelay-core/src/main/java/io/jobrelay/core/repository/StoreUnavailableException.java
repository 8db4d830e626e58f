package io.jobrelay.core.repository;

/**
 * The job store could not be reached or did not answer in time.
 *
 * This exception is transient. Pollers retry on their next tick and
 * HTTP callers receive 503.
 */
public class StoreUnavailableException extends RuntimeException
{
    public StoreUnavailableException(String message)
    {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
