package io.jobrelay.spi;

public class ScriptExecutionException
        extends Exception
{
    public ScriptExecutionException(String message)
    {
        super(message);
    }

    public ScriptExecutionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
