package org.gdbdap.debug;

import java.util.List;

public class ListProcessesResponseBody {
    public List<ProcessInfo> processes = List.of();
    /** Pid of the inferior gdb currently focuses on. */
    public Integer currentProcess;
}
