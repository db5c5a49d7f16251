package org.gdbdap.debug;

/** Arguments for 'breakpointLocations' request. */
public class BreakpointLocationsArguments {
    /** The source location of the breakpoints; 'source.path' must be specified. */
    public Source source;
    /** Start line of range to search possible breakpoint locations in. */
    public Integer line;
    /** Optional end line of range to search possible breakpoint locations in. */
    public Integer endLine;
}
