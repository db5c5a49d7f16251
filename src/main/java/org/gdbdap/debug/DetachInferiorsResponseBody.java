package org.gdbdap.debug;

import java.util.List;

public class DetachInferiorsResponseBody {
    /** Inferiors that are still attached. */
    public List<ProcessInfo> processes = List.of();
    /** Pid of the inferior that is current after the detach, if any is left. */
    public Integer newCurrentPid;
}
