package org.gdbdap.debug;

/** Arguments for 'source' request. */
public class SourceArguments {
    /** Specifies the source content to load. 'source.path' must be specified. */
    public Source source;
}
