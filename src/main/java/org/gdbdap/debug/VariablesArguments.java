package org.gdbdap.debug;

/** Arguments for 'variables' request. */
public class VariablesArguments {
    /** The Variable reference. */
    public Integer variablesReference;
}
