package org.gdbdap.debug;

import java.util.List;

public class ThreadsResponseBody {
    /** All threads. */
    public List<Thread> threads = List.of();
}
