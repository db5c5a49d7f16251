package org.gdbdap;

import static org.gdbdap.mi.MiFields.*;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.gdbdap.debug.ProcessInfo;
import org.gdbdap.mi.MiRecord;

/**
 * Tracks the processes gdb is debugging. gdb calls them inferiors and lists them as thread groups; the thread group
 * list is the only source of truth, nothing is cached here.
 */
public class InferiorOrchestrator {
    private static final Pattern THREAD_TARGET = Pattern.compile("Thread (\\d+)\\.(\\d+)");
    private static final Pattern LWP_TARGET = Pattern.compile("\\(LWP (\\d+)\\)");
    private static final Pattern ADDED_INFERIOR = Pattern.compile("Added inferior (\\d+)");

    private final GdbBackend gdb;
    private final EventTranslator events;

    public InferiorOrchestrator(GdbBackend gdb, EventTranslator events) {
        this.gdb = gdb;
        this.events = events;
    }

    public static class Inferior {
        /** Thread group id, e.g. "i1". */
        public final String id;
        public final int number;
        /** Null while the inferior has no process. */
        public final Integer pid;
        public final boolean current;

        public Inferior(String id, Integer pid, boolean current) {
            this.id = id;
            this.number = Integer.parseInt(id.substring(1));
            this.pid = pid;
            this.current = current;
        }

        Inferior asCurrent() {
            return new Inferior(id, pid, true);
        }

        @Override
        public String toString() {
            return String.format("%s(pid=%s%s)", id, pid, current ? ", current" : "");
        }
    }

    public static class ProcessListing {
        public final CommandResult result;
        public final List<ProcessInfo> processes;

        ProcessListing(CommandResult result, List<ProcessInfo> processes) {
            this.result = result;
            this.processes = processes;
        }
    }

    /**
     * Attach to {@code pid}, make it the only inferior and load symbols from {@code programPath} if given.
     *
     * <p>Stops at the first failing step; whatever was done before it stays done.
     */
    public CommandResult attach(int pid, String programPath) {
        var result = attachSteps(pid, programPath);
        if (!result.success) return CommandResult.failed("Failed to attach to PID " + pid + ": " + result.message);
        LOG.info("Attached to " + pid);
        return result;
    }

    private CommandResult attachSteps(int pid, String programPath) {
        if (findByPid(pid).isEmpty()) {
            var attached = gdb.sendChecked("attach " + pid);
            if (!attached.success) return attached;
        }
        var target = findByPid(pid);
        if (target.isEmpty()) return CommandResult.failed("No inferior found for PID " + pid);
        var number = target.get().number;
        if (!gdb.sendChecked("inferior " + number).success) {
            return CommandResult.failed("Failed to switch to inferior " + number);
        }
        for (var other : threadGroups()) {
            // An inferior without a process has nothing to detach, and gdb refuses to
            if (other.number == number || other.pid == null) continue;
            var detached = gdb.sendChecked("detach inferior " + other.number);
            if (!detached.success) {
                return CommandResult.failed("Failed to detach inferior " + other.id + ": " + detached.message);
            }
        }
        if (programPath != null && !programPath.isEmpty()) {
            var loaded = loadProgramSymbols(programPath);
            if (!loaded.success) return loaded;
        }
        return CommandResult.ok();
    }

    public CommandResult loadProgramSymbols(String programPath) {
        if (!Files.exists(Paths.get(programPath))) {
            return CommandResult.failed("The path " + programPath + " does not exist");
        }
        return gdb.sendChecked("file " + programPath);
    }

    /** Add one inferior per pid and attach it, then switch back to the inferior that was current before. */
    public CommandResult addInferiorsWithPids(List<Integer> pids) {
        if (pids.isEmpty()) return CommandResult.ok();
        var original = currentInferior();
        if (original.isEmpty()) {
            LOG.warning("No current inferior, not adding " + pids);
            return CommandResult.failed("No current inferior");
        }
        try (var suspended = events.suspend()) {
            var created = new ArrayList<Integer>();
            for (var pid : pids) {
                var number = parseAddedInferior(gdb.send("add-inferior"));
                if (number.isEmpty()) return CommandResult.failed("Failed to add inferior for PID " + pid);
                created.add(number.get());
            }
            for (var i = 0; i < created.size(); i++) {
                gdb.sendChecked("inferior " + created.get(i)).check();
                var attached = gdb.sendChecked("attach " + pids.get(i));
                if (!attached.success) {
                    return CommandResult.failed("Failed to attach to PID " + pids.get(i) + ": " + attached.message);
                }
            }
            return gdb.sendChecked("inferior " + original.get());
        }
    }

    /** The inferior number in gdb's {@code Added inferior N} console message. */
    static Optional<Integer> parseAddedInferior(List<MiRecord> records) {
        for (var r : records) {
            if (r.kind != MiRecord.Kind.CONSOLE) continue;
            var matcher = ADDED_INFERIOR.matcher(r.payloadText());
            if (matcher.find()) return Optional.of(Integer.parseInt(matcher.group(1)));
        }
        return Optional.empty();
    }

    /**
     * Detach and remove the inferiors running {@code pids}. If the current inferior goes, another remaining one
     * becomes current.
     *
     * @return the pid of the inferior that is current afterwards
     */
    public Optional<Integer> detachInferiors(List<Integer> pids) {
        var groups = threadGroups();
        var doomed = new ArrayList<Inferior>();
        for (var g : groups) {
            if (g.pid != null && pids.contains(g.pid)) doomed.add(g);
        }
        var current = currentInferior();
        if (current.isPresent() && doomed.stream().anyMatch(g -> g.number == current.get())) {
            var survivor = groups.stream().filter(g -> g.pid != null && !doomed.contains(g)).findFirst();
            if (survivor.isPresent()) {
                gdb.sendChecked("inferior " + survivor.get().number).check();
            } else {
                gdb.sendChecked("detach").check();
            }
        }
        for (var g : doomed) {
            var detached = gdb.sendChecked("detach inferior " + g.number);
            if (!detached.success) LOG.warning("Failed to detach inferior " + g.id + ": " + detached.message);
            var removed = gdb.sendChecked("remove-inferior " + g.number);
            if (!removed.success) LOG.warning("Failed to remove inferior " + g.id + ": " + removed.message);
        }
        return currentPid();
    }

    public boolean selectInferior(int pid) {
        var target = findByPid(pid);
        if (target.isEmpty()) return false;
        return gdb.sendChecked("inferior " + target.get().number).success;
    }

    /** The pid of the current thread's process, or of the first inferior when there is no thread context. */
    public Optional<Integer> currentPid() {
        var info = MiRecord.done(gdb.send("-thread-info"));
        if (info.isPresent()) {
            var currentThread = string(info.get(), "current-thread-id", null);
            for (var element : array(info.get(), "threads")) {
                var thread = object(element);
                if (!string(thread, "id", "").equals(currentThread)) continue;
                var pid = pidFromTargetId(string(thread, "target-id", ""));
                if (pid.isPresent()) return pid;
            }
        }
        return threadGroups().stream().filter(g -> g.pid != null).map(g -> g.pid).findFirst();
    }

    /** Number of the current inferior. Without one, the first inferior is selected and returned. */
    public Optional<Integer> currentInferior() {
        var groups = threadGroups();
        var pid = currentPid();
        if (pid.isPresent()) {
            for (var g : groups) {
                if (pid.get().equals(g.pid)) return Optional.of(g.number);
            }
        }
        if (groups.isEmpty()) return Optional.empty();
        var first = groups.get(0).number;
        if (!gdb.sendChecked("inferior " + first).success) return Optional.empty();
        return Optional.of(first);
    }

    static Optional<Integer> pidFromTargetId(String targetId) {
        var thread = THREAD_TARGET.matcher(targetId);
        if (thread.find()) return Optional.of(Integer.parseInt(thread.group(1)));
        var lwp = LWP_TARGET.matcher(targetId);
        if (lwp.find()) return Optional.of(Integer.parseInt(lwp.group(1)));
        return Optional.empty();
    }

    /** Inferiors that have a process, the current one flagged. */
    public List<Inferior> listInferiors() {
        var pid = currentPid();
        var result = new ArrayList<Inferior>();
        for (var g : threadGroups()) {
            if (g.pid == null) continue;
            result.add(pid.isPresent() && pid.get().equals(g.pid) ? g.asCurrent() : g);
        }
        return result;
    }

    private Optional<Inferior> findByPid(int pid) {
        return threadGroups().stream().filter(g -> g.pid != null && g.pid == pid).findFirst();
    }

    List<Inferior> threadGroups() {
        var groups = MiRecord.done(gdb.send("-list-thread-groups"));
        if (groups.isEmpty()) return ImmutableList.of();
        var result = new ArrayList<Inferior>();
        for (var element : array(groups.get(), "groups")) {
            var group = object(element);
            if (!string(group, "type", "process").equals("process")) continue;
            var id = string(group, "id", "");
            if (!id.matches("i\\d+")) continue;
            result.add(new Inferior(id, integer(group, "pid").orElse(null), false));
        }
        return result;
    }

    /** Processes on the machine gdb runs on, from {@code -info-os processes}. */
    public ProcessListing listProcesses() {
        var records = gdb.send("-info-os processes");
        var result = CommandResult.of(records);
        if (!result.success) return new ProcessListing(result, ImmutableList.of());
        var table = object(MiRecord.done(records).orElse(new JsonObject()), "OSDataTable");
        var processes = new ArrayList<ProcessInfo>();
        for (var element : array(table, "body")) {
            var row = object(element);
            var pid = integer(row, "col0");
            if (pid.isEmpty()) continue;
            processes.add(new ProcessInfo(pid.get(), string(row, "col1", "")));
        }
        return new ProcessListing(result, processes);
    }

    public Optional<Integer> pidByName(String name) {
        for (var p : listProcesses().processes) {
            if (p.name.equals(name)) return Optional.of(p.pid);
        }
        return Optional.empty();
    }

    private static final Logger LOG = Logger.getLogger("main");
}
