package org.gdbdap.debug;

/** Arguments for 'disconnect' request. */
public class DisconnectArguments {
    /** A value of true indicates that this 'disconnect' request is part of a restart sequence. */
    public Boolean restart;
    /** Indicates whether the debuggee should be terminated when the debugger is disconnected. */
    public Boolean terminateDebuggee;
}
