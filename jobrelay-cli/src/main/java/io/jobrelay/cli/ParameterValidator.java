package io.jobrelay.cli;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.ParameterException;

public class ParameterValidator
        implements IParameterValidator
{
    @Override
    public void validate(String name, String value)
        throws ParameterException
    {
        if (!value.contains("=")) {
            throw new ParameterException("Parameter " + name + " expected a value of the form a=b but got: " + value);
        }
    }

    // "a=b" sets a key. a following value without '=' is appended to the previous key with a comma
    public static Map<String, String> toMap(List<String> list)
    {
        Map<String, String> map = new HashMap<>();
        String key = null;

        for (String value : list) {
            int eq = value.indexOf('=');
            if (eq >= 0) {
                key = value.substring(0, eq);
                map.put(key, value.substring(eq + 1));
            }
            else if (key != null) {
                map.put(key, map.get(key) + "," + value);
            }
        }

        return map;
    }
}
