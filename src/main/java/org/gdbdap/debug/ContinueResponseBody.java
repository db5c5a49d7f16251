package org.gdbdap.debug;

public class ContinueResponseBody {
    /** If true, the 'continue' request has ignored the specified thread and continued all threads instead. */
    public Boolean allThreadsContinued;
}
