package org.gdbdap.debug;

/** On error (whenever 'success' is false), the body can provide more details. */
public class ErrorResponse extends Response {
    public static class Body {
        public Message error;
    }
}
