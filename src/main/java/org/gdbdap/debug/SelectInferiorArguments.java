package org.gdbdap.debug;

/** Arguments for 'selectInferior' request. */
public class SelectInferiorArguments {
    public Integer pid;
}
