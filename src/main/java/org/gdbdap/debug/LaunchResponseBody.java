package org.gdbdap.debug;

public class LaunchResponseBody {
    /** Pid of the process that spawns the debuggee, when there is one. */
    public Integer spawnerPid;
}
