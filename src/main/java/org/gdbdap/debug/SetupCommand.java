package org.gdbdap.debug;

/** A raw gdb command run before attaching or launching. */
public class SetupCommand {
    public String text;
    public String description;
    public boolean ignoreFailures;
}
