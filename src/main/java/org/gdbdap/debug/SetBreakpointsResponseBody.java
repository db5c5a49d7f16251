package org.gdbdap.debug;

import java.util.List;

public class SetBreakpointsResponseBody {
    /**
     * Information about the breakpoints. The array elements are in the same order as the elements of the
     * 'breakpoints' array in the arguments.
     */
    public List<Breakpoint> breakpoints = List.of();
}
