package org.gdbdap.debug;

/** Arguments for 'stepOut' request. */
public class StepOutArguments {
    /** Execute 'stepOut' for this thread. */
    public Integer threadId;
    /** If true, only the given thread runs while stepping out. */
    public boolean singleThread;
}
