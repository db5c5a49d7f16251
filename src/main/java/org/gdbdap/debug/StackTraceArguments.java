package org.gdbdap.debug;

/** Arguments for 'stackTrace' request. */
public class StackTraceArguments {
    /** Retrieve the stacktrace for this thread. */
    public Integer threadId;
    /** The index of the first frame to return; if omitted frames start at 0. */
    public Integer startFrame;
    /** The maximum number of frames to return. If levels is not specified or 0, all frames are returned. */
    public Integer levels;
}
