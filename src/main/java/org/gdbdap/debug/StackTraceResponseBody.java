package org.gdbdap.debug;

import java.util.List;

public class StackTraceResponseBody {
    /** The frames of the stackframe. */
    public List<StackFrame> stackFrames = List.of();
    /** The total number of frames available. */
    public Integer totalFrames;
}
