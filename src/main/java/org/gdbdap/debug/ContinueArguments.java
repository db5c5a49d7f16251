package org.gdbdap.debug;

/** Arguments for 'continue' request. */
public class ContinueArguments {
    /** Continue execution for the specified thread (if possible). */
    public Integer threadId;
}
