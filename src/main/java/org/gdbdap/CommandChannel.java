package org.gdbdap;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.gdbdap.mi.MiParser;
import org.gdbdap.mi.MiRecord;

/**
 * Owns the pipes to a gdb process speaking mi.
 *
 * <p>A monitor thread reads every line gdb writes. Async stop/run/process notifications go to the {@link
 * EventTranslator}; everything else lands in a reply queue that {@link #send} drains. Commands are serialized by a
 * single lock, so at most one command is waiting for its result at any time.
 */
public class CommandChannel implements GdbBackend, Closeable {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);
    public static final Set<String> DEFAULT_ACCEPTED = ImmutableSet.of("done", "error", "running");

    private static final Set<String> EVENTS =
            ImmutableSet.of("stopped", "running", "thread-group-started", "thread-group-exited");

    private final EventTranslator events;
    private final Duration defaultTimeout;
    private final BlockingQueue<MiRecord> replies = new LinkedBlockingQueue<>();
    private final Object sendLock = new Object();
    private Writer toGdb;
    private volatile boolean running;

    public CommandChannel(EventTranslator events, Duration defaultTimeout) {
        this.events = events;
        this.defaultTimeout = defaultTimeout;
    }

    /** Start reading {@code fromGdb} on a daemon thread; commands are written to {@code toGdb}. */
    public void connect(InputStream fromGdb, OutputStream toGdb) {
        synchronized (sendLock) {
            if (running) throw new IllegalStateException("Already connected");
            this.toGdb = new OutputStreamWriter(toGdb, Charsets.UTF_8);
            var reader = new BufferedReader(new InputStreamReader(fromGdb, Charsets.UTF_8));
            running = true;
            var monitor =
                    new ThreadFactoryBuilder()
                            .setNameFormat("gdb-monitor")
                            .setDaemon(true)
                            .build()
                            .newThread(() -> monitor(reader));
            monitor.start();
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void monitor(BufferedReader fromGdb) {
        try {
            for (var line = fromGdb.readLine(); line != null; line = fromGdb.readLine()) {
                var record = MiParser.parse(line);
                if (record.isPresent()) route(record.get());
            }
            LOG.info("gdb closed its output");
        } catch (IOException e) {
            if (running) LOG.log(Level.WARNING, "Failed to read from gdb", e);
        } finally {
            running = false;
        }
    }

    void route(MiRecord record) {
        LOG.fine("<< " + record);
        if (record.kind == MiRecord.Kind.NOTIFY && EVENTS.contains(record.message)) {
            events.route(record);
        } else {
            replies.add(record);
        }
    }

    @Override
    public List<MiRecord> send(String command) {
        return send(command, defaultTimeout, DEFAULT_ACCEPTED);
    }

    @Override
    public List<MiRecord> send(String command, Duration timeout, Set<String> accepted) {
        synchronized (sendLock) {
            if (!running) throw new BackendUnavailableException("gdb is not running");
            // Anything left over belongs to an earlier command that timed out
            var stale = new ArrayList<MiRecord>();
            replies.drainTo(stale);
            if (!stale.isEmpty()) LOG.fine("Discarded " + stale.size() + " stale records before " + command);

            LOG.fine(">> " + command);
            write(command);
            var pending = new PendingCommand(command, accepted, System.nanoTime() + timeout.toNanos());
            return pending.await(timeout);
        }
    }

    private void write(String command) {
        try {
            toGdb.write(command);
            toGdb.write("\n");
            toGdb.flush();
        } catch (IOException e) {
            running = false;
            throw new BackendUnavailableException("Failed to write to gdb: " + e.getMessage(), e);
        }
    }

    private class PendingCommand {
        final String command;
        final Set<String> accepted;
        final long deadline;
        final List<MiRecord> received = new ArrayList<>();

        PendingCommand(String command, Set<String> accepted, long deadline) {
            this.command = command;
            this.accepted = accepted;
            this.deadline = deadline;
        }

        List<MiRecord> await(Duration timeout) {
            try {
                while (true) {
                    var remaining = deadline - System.nanoTime();
                    if (remaining <= 0) break;
                    var next = replies.poll(remaining, TimeUnit.NANOSECONDS);
                    if (next == null) break;
                    received.add(next);
                    if (next.kind == MiRecord.Kind.RESULT && accepted.contains(next.message)) {
                        return ImmutableList.copyOf(received);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warning("Interrupted while waiting for " + command);
            }
            var seconds = timeout.toMillis() / 1000.0;
            var message =
                    String.format(
                            "Expected response not received within %s seconds for command '%s'.", seconds, command);
            LOG.warning(message);
            return ImmutableList.of(MiRecord.error(message));
        }
    }

    @Override
    public void close() {
        synchronized (sendLock) {
            running = false;
            if (toGdb == null) return;
            try {
                toGdb.close();
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to close gdb input", e);
            }
        }
    }

    private static final Logger LOG = Logger.getLogger("main");
}
