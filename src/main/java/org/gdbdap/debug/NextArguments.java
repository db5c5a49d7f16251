package org.gdbdap.debug;

/** Arguments for 'next' request. */
public class NextArguments {
    /** Execute 'next' for this thread. */
    public Integer threadId;
}
