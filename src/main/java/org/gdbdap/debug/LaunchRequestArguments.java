package org.gdbdap.debug;

/** Arguments for 'launch' request. */
public class LaunchRequestArguments {
    /** Executable to run under gdb. */
    public String program;
    /** Command line arguments passed to the program. */
    public String[] args = {};
    /** Commands sent to gdb before launching. */
    public SetupCommand[] setupCommands = {};
    /** Optional gdbserver address. */
    public String gdbServer;
}
