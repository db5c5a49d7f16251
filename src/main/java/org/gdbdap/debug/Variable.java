package org.gdbdap.debug;

/**
 * A Variable is a name/value pair. If the value is structured (has children), a handle is provided in
 * variablesReference for retrieving the children with the VariablesRequest.
 */
public class Variable {
    /** The variable's name. */
    public String name;
    /** The variable's value. */
    public String value;
    /** The type of the variable's value. */
    public String type;
    /** If variablesReference is > 0, the variable is structured and its children can be retrieved. */
    public int variablesReference;

    public Variable() {}

    public Variable(String name, String value, int variablesReference) {
        this.name = name;
        this.value = value;
        this.variablesReference = variablesReference;
    }
}
