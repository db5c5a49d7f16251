package org.gdbdap.debug;

/** Arguments for 'setBreakpoints' request. */
public class SetBreakpointsArguments {
    /** The source location of the breakpoints; 'source.path' must be specified. */
    public Source source;
    /** The code locations of the breakpoints. */
    public SourceBreakpoint[] breakpoints = {};
}
