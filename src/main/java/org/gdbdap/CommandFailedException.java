package org.gdbdap;

/** gdb answered {@code ^error} to a command whose output is needed to continue. */
public class CommandFailedException extends DebugAdapterException {
    public CommandFailedException(CommandResult result) {
        super(result.message);
    }
}
