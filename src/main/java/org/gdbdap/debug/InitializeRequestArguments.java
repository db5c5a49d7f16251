package org.gdbdap.debug;

/** Arguments for 'initialize' request. */
public class InitializeRequestArguments {
    /** The ID of the (frontend) client using this adapter. */
    public String clientID;
    /** The human readable name of the (frontend) client using this adapter. */
    public String clientName;
    /** The ID of the debug adapter. */
    public String adapterID;
    /** If true all line numbers are 1-based (default). */
    public Boolean linesStartAt1;
}
