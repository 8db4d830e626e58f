package io.jobrelay.core.chain;

import java.util.Locale;
import io.jobrelay.client.config.ConfigException;

public enum ChainPolicy
{
    // dependents run after every completion of the parent
    ALWAYS,

    // dependents run only after a successful run of the parent
    SUCCESS_ONLY;

    public boolean shouldPropagate(boolean parentSucceeded)
    {
        return this == ALWAYS || parentSucceeded;
    }

    public static ChainPolicy fromString(String name)
    {
        switch (name.toLowerCase(Locale.ENGLISH)) {
        case "always":
            return ALWAYS;
        case "success_only":
            return SUCCESS_ONLY;
        default:
            throw new ConfigException("chain.policy must be 'always' or 'success_only': " + name);
        }
    }
}
