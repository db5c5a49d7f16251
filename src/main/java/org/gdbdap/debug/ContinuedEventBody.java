package org.gdbdap.debug;

public class ContinuedEventBody {
    /** The thread which was continued. */
    public int threadId;
    /** If 'allThreadsContinued' is true, a debug adapter can announce that all threads have continued. */
    public boolean allThreadsContinued;

    public ContinuedEventBody() {}

    public ContinuedEventBody(int threadId, boolean allThreadsContinued) {
        this.threadId = threadId;
        this.allThreadsContinued = allThreadsContinued;
    }
}
