package org.gdbdap.debug;

/** Arguments for 'stepIn' request. */
public class StepInArguments {
    /** Execute 'stepIn' for this thread. */
    public Integer threadId;
}
