package io.jobrelay.cli;

/**
 * Ends a command with an exit code. A null message means a normal exit after
 * usage was printed.
 */
public class SystemExitException
        extends Exception
{
    private final int code;

    private SystemExitException(int code, String message)
    {
        super(message);
        this.code = code;
    }

    public static SystemExitException systemExit(String errorMessage)
    {
        return errorMessage == null
            ? new SystemExitException(0, null)
            : new SystemExitException(1, errorMessage);
    }

    public int getCode()
    {
        return code;
    }

    public boolean hasErrorMessage()
    {
        return getMessage() != null;
    }
}
