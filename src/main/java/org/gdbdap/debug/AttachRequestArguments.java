package org.gdbdap.debug;

/** Arguments for 'attach' request. */
public class AttachRequestArguments {
    /** OS process id to attach to. */
    public Integer pid;
    /** Executable whose symbols should be loaded after attaching. */
    public String program;
    /** Commands sent to gdb before attaching. */
    public SetupCommand[] setupCommands = {};
    /** Optional gdbserver address, e.g. localhost:2345. */
    public String gdbServer;
}
