package org.gdbdap.debug;

/** Information about the capabilities of a debug adapter. */
public class Capabilities {
    /** The debug adapter supports the 'configurationDone' request. */
    public Boolean supportsConfigurationDoneRequest;
    /** The debug adapter supports function breakpoints. */
    public Boolean supportsFunctionBreakpoints;
    /** The debug adapter supports conditional breakpoints. */
    public Boolean supportsConditionalBreakpoints;
    /** The debug adapter supports a (side effect free) evaluate request for data hovers. */
    public Boolean supportsEvaluateForHovers;
    /** The debug adapter supports setting a variable to a value. */
    public Boolean supportsSetVariable;
    /** The debug adapter supports the 'gotoTargets' request. */
    public Boolean supportsGotoTargetsRequest;
    /** The debug adapter supports the 'completions' request. */
    public Boolean supportsCompletionsRequest;
    /** The debug adapter supports the 'modules' request. */
    public Boolean supportsModulesRequest;
    /** The debug adapter supports a 'format' attribute on the stackTrace, variables, and evaluate requests. */
    public Boolean supportsValueFormattingOptions;
    /** The debug adapter supports logpoints by interpreting the 'logMessage' attribute of the SourceBreakpoint. */
    public Boolean supportsLogPoints;
    /** The debug adapter supports data breakpoints. */
    public Boolean supportsDataBreakpoints;
    /** The debug adapter supports the 'readMemory' request. */
    public Boolean supportsReadMemoryRequest;
    /** The debug adapter supports the 'disassemble' request. */
    public Boolean supportsDisassembleRequest;
    /** The debug adapter supports the 'breakpointLocations' request. */
    public Boolean supportsBreakpointLocationsRequest;
    /** The debug adapter supports the 'clipboard' context value in the 'evaluate' request. */
    public Boolean supportsClipboardContext;
}
