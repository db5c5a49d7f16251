package org.gdbdap.debug;

/** Properties of a breakpoint location returned from the 'breakpointLocations' request. */
public class BreakpointLocation {
    /** Start line of breakpoint location. */
    public int line;

    public BreakpointLocation() {}

    public BreakpointLocation(int line) {
        this.line = line;
    }
}
