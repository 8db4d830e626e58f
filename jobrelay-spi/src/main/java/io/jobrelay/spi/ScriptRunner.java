package io.jobrelay.spi;

public interface ScriptRunner
{
    /**
     * Runs the script and blocks until it finishes or times out.
     * A script that ran and failed is returned as a failed result. The exception
     * is for runs that could not be carried out at all.
     */
    ScriptResult run(ScriptRequest request)
        throws ScriptExecutionException;
}
