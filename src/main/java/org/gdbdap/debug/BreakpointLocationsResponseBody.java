package org.gdbdap.debug;

import java.util.List;

public class BreakpointLocationsResponseBody {
    /** Sorted set of possible breakpoint locations. */
    public List<BreakpointLocation> breakpoints = List.of();
}
