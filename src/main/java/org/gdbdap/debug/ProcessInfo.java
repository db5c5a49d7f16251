package org.gdbdap.debug;

/** One row of the OS process table. */
public class ProcessInfo {
    public int pid;
    public String name;

    public ProcessInfo() {}

    public ProcessInfo(int pid, String name) {
        this.pid = pid;
        this.name = name;
    }
}
