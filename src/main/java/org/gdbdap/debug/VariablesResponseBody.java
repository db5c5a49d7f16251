package org.gdbdap.debug;

import java.util.List;

public class VariablesResponseBody {
    /** All (or a range) of variables for the given variable reference. */
    public List<Variable> variables = List.of();
}
