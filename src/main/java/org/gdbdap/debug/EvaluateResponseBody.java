package org.gdbdap.debug;

public class EvaluateResponseBody {
    /** The result of the evaluate request. */
    public String result;
    /** If variablesReference is > 0, the evaluate result is structured. */
    public int variablesReference;
}
