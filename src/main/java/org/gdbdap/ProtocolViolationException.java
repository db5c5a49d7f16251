package org.gdbdap;

/** A request is missing a field it cannot be served without. */
public class ProtocolViolationException extends DebugAdapterException {
    public ProtocolViolationException(String message) {
        super(message);
    }
}
