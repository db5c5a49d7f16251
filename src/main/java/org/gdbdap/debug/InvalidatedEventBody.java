package org.gdbdap.debug;

import java.util.List;

public class InvalidatedEventBody {
    /** Which parts of the UI have to be refetched: 'all', 'stacks', 'threads', 'variables'. */
    public List<String> areas = List.of();

    public InvalidatedEventBody() {}

    public InvalidatedEventBody(List<String> areas) {
        this.areas = areas;
    }
}
