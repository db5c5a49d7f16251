package org.gdbdap.debug;

import java.util.List;

public interface DebugServer {
    /** Serve one request. The response comes first, followed by any events that must be sent after it. */
    List<ProtocolMessage> handle(Request request);
}
