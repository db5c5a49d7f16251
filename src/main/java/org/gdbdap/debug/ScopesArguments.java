package org.gdbdap.debug;

/** Arguments for 'scopes' request. */
public class ScopesArguments {
    /** Retrieve the scopes for this stackframe. */
    public Integer frameId;
}
