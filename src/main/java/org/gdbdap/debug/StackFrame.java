package org.gdbdap.debug;

/** A Stackframe contains the source location. */
public class StackFrame {
    /** An identifier for the stack frame. gdb frame levels are used directly. */
    public int id;
    /** The name of the stack frame, typically a method name. */
    public String name;
    /** The optional source of the frame. */
    public Source source;
    /** The line within the file of the frame. If source is null or doesn't exist, line is 0 and must be ignored. */
    public int line;
    /** The column within the line. gdb does not report columns, so this is always 0. */
    public int column;
    /** Optional memory reference for the current instruction pointer in this frame. */
    public String instructionPointerReference;
}
