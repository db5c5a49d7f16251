package org.gdbdap.debug;

/** Information about a Breakpoint created in setBreakpoints. */
public class Breakpoint {
    /** The gdb breakpoint number, when the breakpoint could be inserted. */
    public Integer id;
    /** If true breakpoint could be set (but not necessarily at the desired location). */
    public boolean verified;
    /** Explains why a breakpoint could not be verified. */
    public String message;
    /** The source where the breakpoint is located. */
    public Source source;
    /** The start line of the actual range covered by the breakpoint. */
    public Integer line;
}
