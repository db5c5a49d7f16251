package org.gdbdap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.gdbdap.debug.DebugClient;

/** One gdb process and everything that talks to it. Created once per adapter run. */
public class Session {
    static final List<String> INITIAL_COMMANDS =
            ImmutableList.of(
                    "-gdb-set mi-async on",
                    "-gdb-set confirm off",
                    "-enable-pretty-printing",
                    "set pagination off",
                    "set auto-solib-add on");

    /** Settings gdb and a connected gdbserver must agree on. */
    static final List<String> SHARED_SETTINGS =
            ImmutableList.of(
                    "set osabi auto",
                    "set follow-fork-mode parent",
                    "set follow-exec-mode same",
                    "set detach-on-fork off",
                    "set scheduler-locking off",
                    "set schedule-multiple on");

    private final AdapterSettings settings;
    private final CommandChannel channel;
    private Process process;

    public final GdbBackend gdb;
    public final EventTranslator events;
    public final VariableReferenceTree variables;
    public final InferiorOrchestrator inferiors;
    public final BreakpointManager breakpoints;
    public final ExecutionControl execution;

    public Session(AdapterSettings settings, DebugClient client) {
        this.settings = settings;
        this.events = new EventTranslator(client);
        this.channel = new CommandChannel(events, settings.commandTimeout);
        this.gdb = channel;
        this.variables = new VariableReferenceTree(gdb);
        this.inferiors = new InferiorOrchestrator(gdb, events);
        this.breakpoints = new BreakpointManager(gdb);
        this.execution = new ExecutionControl(gdb);
    }

    /** A session over an already running backend. */
    Session(EventTranslator events, GdbBackend gdb) {
        this.settings = new AdapterSettings();
        this.events = events;
        this.channel = null;
        this.gdb = gdb;
        this.variables = new VariableReferenceTree(gdb);
        this.inferiors = new InferiorOrchestrator(gdb, events);
        this.breakpoints = new BreakpointManager(gdb);
        this.execution = new ExecutionControl(gdb);
    }

    /** Launch gdb and configure it. */
    public void start() throws IOException {
        var command = List.of(settings.gdbPath, "--nx", "--quiet", "--interpreter=mi3");
        LOG.info("Starting " + String.join(" ", command));
        process = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.INHERIT).start();
        channel.connect(process.getInputStream(), process.getOutputStream());
        for (var c : INITIAL_COMMANDS) {
            var result = gdb.sendChecked(c);
            if (!result.success) LOG.warning(c + ": " + result.message);
        }
        sendSharedSettings();
    }

    public void sendSharedSettings() {
        for (var c : SHARED_SETTINGS) {
            var result = gdb.sendChecked(c);
            if (!result.success) LOG.warning(c + ": " + result.message);
        }
    }

    /**
     * Connect to a gdbserver in multi-process mode. Whatever process gdbserver was started with is detached again,
     * the caller attaches to the processes it wants.
     */
    public CommandResult connectToGdbServer(String address) {
        var connected = gdb.sendChecked("target extended-remote " + address);
        if (!connected.success) {
            return CommandResult.failed("Failed to connect to gdbserver at " + address + ": " + connected.message);
        }
        sendSharedSettings();
        gdb.sendChecked("detach", true);
        LOG.info("Connected to gdbserver at " + address);
        return CommandResult.ok();
    }

    public void stop() {
        events.disable();
        if (channel != null && channel.isRunning()) {
            try {
                channel.send("-gdb-exit", Duration.ofSeconds(2), ImmutableSet.of("exit", "done", "error"));
            } catch (BackendUnavailableException e) {
                LOG.log(Level.FINE, "gdb already gone", e);
            }
        }
        if (channel != null) channel.close();
        if (process != null) {
            try {
                if (!process.waitFor(2, TimeUnit.SECONDS)) {
                    LOG.warning("gdb did not exit, killing it");
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
        events.close();
    }

    private static final Logger LOG = Logger.getLogger("main");
}
