package org.gdbdap.debug;

public class SourceResponseBody {
    /** Content of the source reference. */
    public String content;
}
