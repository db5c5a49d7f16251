package org.gdbdap.debug;

import java.util.List;

public class StoppedEventBody {
    /** The reason for the event: 'step', 'breakpoint', 'exception', 'pause', 'entry', etc. */
    public String reason;
    /** The thread which was stopped. */
    public int threadId;
    /** If 'allThreadsStopped' is true, a debug adapter can announce that all threads have stopped. */
    public boolean allThreadsStopped;
    /** Ids of the breakpoints that triggered the event. */
    public List<Integer> hitBreakpointIds = List.of();

    public StoppedEventBody() {}

    public StoppedEventBody(String reason, int threadId, boolean allThreadsStopped, List<Integer> hitBreakpointIds) {
        this.reason = reason;
        this.threadId = threadId;
        this.allThreadsStopped = allThreadsStopped;
        this.hitBreakpointIds = hitBreakpointIds;
    }
}
