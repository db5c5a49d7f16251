package org.gdbdap.debug;

/** Events the adapter pushes to the client outside of any request. */
public interface DebugClient {
    void initialized();

    void stopped(StoppedEventBody evt);

    void continued(ContinuedEventBody evt);

    void invalidated(InvalidatedEventBody evt);

    /** A new inferior appeared. Custom event 'newProcess'. */
    void newProcess();

    /** An inferior exited. Custom event 'exitedProcess'. */
    void exitedProcess();
}
