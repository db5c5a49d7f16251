package org.gdbdap.debug;

import java.util.List;

/** Arguments for 'addInferiors' and 'detachInferiors' requests. */
public class InferiorPidsArguments {
    public List<Integer> pids = List.of();
}
