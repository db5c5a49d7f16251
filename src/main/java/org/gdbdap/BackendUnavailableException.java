package org.gdbdap;

/** gdb was never started, its output stream closed, or the process died. */
public class BackendUnavailableException extends DebugAdapterException {
    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
