package org.gdbdap.debug;

import java.util.List;

public class ScopesResponseBody {
    /** The scopes of the stackframe. If the array has length zero, there are no scopes available. */
    public List<Scope> scopes = List.of();
}
