package org.gdbdap;

/** Base of every failure a request handler can report back to the client. */
public class DebugAdapterException extends RuntimeException {
    public DebugAdapterException(String message) {
        super(message);
    }

    public DebugAdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
