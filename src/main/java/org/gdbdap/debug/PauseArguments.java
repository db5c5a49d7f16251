package org.gdbdap.debug;

/** Arguments for 'pause' request. */
public class PauseArguments {
    /** Pause execution for this thread. */
    public Integer threadId;
}
