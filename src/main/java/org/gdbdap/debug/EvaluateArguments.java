package org.gdbdap.debug;

/** Arguments for 'evaluate' request. */
public class EvaluateArguments {
    /** The expression to evaluate. Passed to gdb verbatim. */
    public String expression = "";
    /** The context in which the evaluate request is run: 'watch', 'repl', 'hover', etc. */
    public String context;
}
