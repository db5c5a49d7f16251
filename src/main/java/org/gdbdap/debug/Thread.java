package org.gdbdap.debug;

/** A Thread */
public class Thread {
    /** Unique identifier for the thread. */
    public int id;
    /** A name of the thread. */
    public String name;

    public Thread() {}

    public Thread(int id, String name) {
        this.id = id;
        this.name = name;
    }
}
