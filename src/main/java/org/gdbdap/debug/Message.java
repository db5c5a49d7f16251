package org.gdbdap.debug;

/** A structured message object. Used to return errors from requests. */
public class Message {
    /** Unique identifier for the message. */
    public int id;
    /** A format string for the message. */
    public String format;
    /** If true show user. */
    public Boolean showUser;
}
