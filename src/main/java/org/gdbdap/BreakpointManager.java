package org.gdbdap;

import static org.gdbdap.mi.MiFields.*;

import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;
import org.gdbdap.debug.Breakpoint;
import org.gdbdap.debug.Source;
import org.gdbdap.debug.SourceBreakpoint;
import org.gdbdap.mi.MiRecord;

/** Makes gdb's breakpoints in a file match the list the client last sent for that file. */
public class BreakpointManager {
    private final GdbBackend gdb;
    private final Map<String, List<Breakpoint>> bySource = new HashMap<>();

    public BreakpointManager(GdbBackend gdb) {
        this.gdb = gdb;
    }

    public static class SetBreakpointsResult {
        public final boolean success;
        public final String message;
        public final List<Breakpoint> breakpoints;

        SetBreakpointsResult(boolean success, String message, List<Breakpoint> breakpoints) {
            this.success = success;
            this.message = message;
            this.breakpoints = breakpoints;
        }
    }

    /**
     * Delete every breakpoint gdb has in {@code sourcePath}, then insert {@code specs}. Each insertion is verified on
     * its own; one bad line doesn't stop the rest.
     */
    public SetBreakpointsResult setBreakpoints(String sourcePath, List<SourceBreakpoint> specs) {
        var cleared = clear(sourcePath);
        if (!cleared.success) return new SetBreakpointsResult(false, cleared.message, List.of());
        var placed = new ArrayList<Breakpoint>();
        for (var spec : specs) {
            placed.add(insert(sourcePath, spec));
        }
        bySource.put(sourcePath, placed);
        return new SetBreakpointsResult(true, "", placed);
    }

    private Breakpoint insert(String sourcePath, SourceBreakpoint spec) {
        var command = new StringBuilder("-break-insert ");
        if (spec.condition != null && !spec.condition.isBlank()) {
            command.append("-c ").append(quote(spec.condition)).append(' ');
        }
        command.append(sourcePath).append(':').append(spec.line);

        var records = gdb.send(command.toString());
        var result = CommandResult.of(records);
        var breakpoint = new Breakpoint();
        breakpoint.source = new Source(null, sourcePath);
        breakpoint.line = spec.line;
        breakpoint.verified = result.success;
        breakpoint.message = result.message;
        if (result.success) {
            var bkpt = object(MiRecord.done(records).orElse(new JsonObject()), "bkpt");
            breakpoint.id = integer(bkpt, "number").orElse(null);
            breakpoint.line = integer(bkpt, "line", spec.line);
        }
        return breakpoint;
    }

    /** Delete the breakpoints gdb has in {@code sourcePath}, matched on full or plain file name. */
    public CommandResult clear(String sourcePath) {
        var records = gdb.send("-break-list");
        var listed = CommandResult.of(records);
        if (!listed.success) return listed;
        var table = object(MiRecord.done(records).orElse(new JsonObject()), "BreakpointTable");
        for (var element : array(table, "body")) {
            var bkpt = object(element);
            var inFile =
                    sourcePath.equals(string(bkpt, "fullname", null)) || sourcePath.equals(string(bkpt, "file", null));
            var number = string(bkpt, "number", null);
            if (!inFile || number == null) continue;
            var deleted = gdb.sendChecked("-break-delete " + number);
            if (!deleted.success) return deleted;
        }
        bySource.remove(sourcePath);
        return CommandResult.ok();
    }

    /** Breakpoints placed by the last {@link #setBreakpoints} for {@code sourcePath}. */
    public List<Breakpoint> breakpoints(String sourcePath) {
        return bySource.getOrDefault(sourcePath, List.of());
    }

    /**
     * Lines of {@code sourcePath} that have code, limited to {@code line} or to {@code [line, endLine]}.
     *
     * @return sorted, without duplicates
     */
    public List<Integer> getBreakpointLocations(String sourcePath, int line, Integer endLine) {
        var records = gdb.send("-symbol-list-lines " + sourcePath);
        CommandResult.of(records).check();
        var last = endLine == null ? line : endLine;
        var lines = new TreeSet<Integer>();
        for (var element : array(MiRecord.done(records).orElse(new JsonObject()), "lines")) {
            var candidate = integer(object(element), "line");
            if (candidate.isPresent() && candidate.get() >= line && candidate.get() <= last) lines.add(candidate.get());
        }
        return new ArrayList<>(lines);
    }

    public CommandResult setBreakpointOnMain() {
        var result = gdb.sendChecked("-break-insert main");
        if (!result.success) LOG.warning("Failed to break on main: " + result.message);
        return result;
    }

    private static String quote(String condition) {
        return "\"" + condition.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static final Logger LOG = Logger.getLogger("main");
}
