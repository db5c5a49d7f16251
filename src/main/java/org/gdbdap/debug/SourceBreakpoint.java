package org.gdbdap.debug;

/** Properties of a breakpoint passed to the setBreakpoints request. */
public class SourceBreakpoint {
    /** The source line of the breakpoint. */
    public int line;
    /** An optional source column of the breakpoint. */
    public Integer column;
    /** An optional expression for conditional breakpoints. */
    public String condition;

    public SourceBreakpoint() {}

    public SourceBreakpoint(int line) {
        this.line = line;
    }
}
