package org.gdbdap.debug;

/**
 * A Source is a descriptor for source code. It is returned from the debug adapter as part of a StackFrame and it is
 * used by clients when specifying breakpoints.
 */
public class Source {
    /** The short name of the source. */
    public String name;
    /** The path of the source to be shown in the UI. */
    public String path;

    public Source() {}

    public Source(String name, String path) {
        this.name = name;
        this.path = path;
    }
}
