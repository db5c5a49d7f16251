package org.gdbdap;

public class NotFoundException extends DebugAdapterException {
    public NotFoundException(String message) {
        super(message);
    }
}
