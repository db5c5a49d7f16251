package org.gdbdap;

import static org.gdbdap.mi.MiFields.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.gdbdap.debug.ContinuedEventBody;
import org.gdbdap.debug.DebugClient;
import org.gdbdap.debug.InvalidatedEventBody;
import org.gdbdap.debug.StoppedEventBody;
import org.gdbdap.mi.MiRecord;

/**
 * Turns gdb async notifications into client events.
 *
 * <p>Events only reach the client while the gate is open. It starts closed; the first successful attach or launch
 * opens it. Delivery runs on its own thread so a slow client never holds up the gdb monitor.
 */
public class EventTranslator implements Closeable {
    private final DebugClient client;
    private final Executor delivery;
    private volatile boolean enabled;

    public EventTranslator(DebugClient client) {
        this(client, Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("dap-events").setDaemon(true).build()));
    }

    EventTranslator(DebugClient client, Executor delivery) {
        this.client = client;
        this.delivery = delivery;
    }

    public void route(MiRecord record) {
        var payload = record.payloadObject();
        switch (record.message) {
            case "stopped":
                {
                    var reason = string(payload, "reason", "unknown");
                    var threadId = integer(payload, "thread-id", 1);
                    var all = "all".equals(string(payload, "stopped-threads", ""));
                    List<Integer> hit = List.of();
                    if (reason.contains("breakpoint") && payload.has("bkptno")) {
                        hit = List.of(integer(payload, "bkptno", 0));
                    }
                    notifyStopped(new StoppedEventBody(reason, threadId, all, hit));
                    return;
                }
            case "running":
                {
                    // gdb says "all" when every thread resumed; the client wants a number either way
                    var all = "all".equals(string(payload, "thread-id", ""));
                    var threadId = all ? 1 : integer(payload, "thread-id", 1);
                    notifyContinued(new ContinuedEventBody(threadId, all));
                    notifyInvalidated(new InvalidatedEventBody(List.of("stacks")));
                    return;
                }
            case "thread-group-started":
                notifyProcessCreated();
                return;
            case "thread-group-exited":
                notifyProcessExited();
                return;
            default:
                LOG.fine("Ignored async record " + record);
        }
    }

    public void notifyStopped(StoppedEventBody evt) {
        dispatch("stopped", () -> client.stopped(evt));
    }

    public void notifyContinued(ContinuedEventBody evt) {
        dispatch("continued", () -> client.continued(evt));
    }

    public void notifyInvalidated(InvalidatedEventBody evt) {
        dispatch("invalidated", () -> client.invalidated(evt));
    }

    public void notifyProcessCreated() {
        dispatch("newProcess", client::newProcess);
    }

    public void notifyProcessExited() {
        dispatch("exitedProcess", client::exitedProcess);
    }

    private void dispatch(String event, Runnable send) {
        if (!enabled) {
            LOG.fine("Dropped " + event + " event, notifications are suspended");
            return;
        }
        delivery.execute(
                () -> {
                    try {
                        send.run();
                    } catch (RuntimeException e) {
                        LOG.log(Level.WARNING, "Failed to send " + event + " event", e);
                    }
                });
    }

    public void enable() {
        enabled = true;
    }

    public void disable() {
        enabled = false;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Close the gate until the returned guard is closed, then restore whatever state it had. */
    public Suspension suspend() {
        var suspension = new Suspension(enabled);
        enabled = false;
        return suspension;
    }

    public class Suspension implements AutoCloseable {
        private final boolean restore;

        private Suspension(boolean restore) {
            this.restore = restore;
        }

        @Override
        public void close() {
            enabled = restore;
        }
    }

    @Override
    public void close() {
        if (delivery instanceof ExecutorService) ((ExecutorService) delivery).shutdown();
    }

    private static final Logger LOG = Logger.getLogger("main");
}
