package org.gdbdap.debug;

/** A Scope is a named container for variables. */
public class Scope {
    /** Name of the scope such as 'Locals' or 'Registers'. This string is shown in the UI as is. */
    public String name;
    /** An optional hint for how to present this scope in the UI. 'locals' | 'registers'. */
    public String presentationHint;
    /** The variables of this scope can be retrieved by passing this value to the VariablesRequest. */
    public int variablesReference;
    /** If true, the number of variables in this scope is large or expensive to retrieve. */
    public boolean expensive;

    public Scope() {}

    public Scope(String name, String presentationHint, int variablesReference) {
        this.name = name;
        this.presentationHint = presentationHint;
        this.variablesReference = variablesReference;
    }
}
