package org.gdbdap;

import static org.gdbdap.mi.MiFields.*;

import com.google.common.base.Joiner;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.gdbdap.debug.Source;
import org.gdbdap.debug.StackFrame;
import org.gdbdap.debug.Thread;
import org.gdbdap.mi.MiRecord;

/** Threads, stacks, and the run/step commands. */
public class ExecutionControl {
    private static final Pattern SHELL_SAFE = Pattern.compile("[\\w@%+=:,./-]+");

    private final GdbBackend gdb;

    public ExecutionControl(GdbBackend gdb) {
        this.gdb = gdb;
    }

    public List<Thread> threads() {
        var records = gdb.send("-thread-info");
        CommandResult.of(records).check();
        var result = new ArrayList<Thread>();
        for (var element : array(MiRecord.done(records).orElse(new JsonObject()), "threads")) {
            var thread = object(element);
            var id = integer(thread, "id");
            if (id.isEmpty()) continue;
            var name = string(thread, "name", string(thread, "target-id", "Thread " + id.get()));
            result.add(new Thread(id.get(), name));
        }
        return result;
    }

    public List<StackFrame> stackTrace(int threadId) {
        gdb.sendChecked("-thread-select " + threadId).check();
        var records = gdb.send("-stack-list-frames");
        CommandResult.of(records).check();
        var result = new ArrayList<StackFrame>();
        for (var element : array(MiRecord.done(records).orElse(new JsonObject()), "stack")) {
            var frame = object(element);
            var f = new StackFrame();
            f.id = integer(frame, "level", result.size());
            f.name = string(frame, "func", "??");
            var fullname = string(frame, "fullname", null);
            if (fullname != null) f.source = new Source(string(frame, "file", null), fullname);
            f.line = integer(frame, "line", 0);
            f.column = 0;
            f.instructionPointerReference = string(frame, "addr", null);
            result.add(f);
        }
        return result;
    }

    public CommandResult resume(Integer threadId) {
        if (threadId == null) return gdb.sendChecked("-exec-continue");
        return gdb.sendChecked("-exec-continue --thread " + threadId);
    }

    public CommandResult pause(Integer threadId) {
        var selected = selectThread(threadId);
        if (!selected.success) return selected;
        return gdb.sendChecked("-exec-interrupt");
    }

    public CommandResult next(Integer threadId) {
        var selected = selectThread(threadId);
        if (!selected.success) return selected;
        return gdb.sendChecked("-exec-next");
    }

    public CommandResult stepIn(Integer threadId) {
        var selected = selectThread(threadId);
        if (!selected.success) return selected;
        return gdb.sendChecked("-exec-step");
    }

    /** Run until the current function returns, optionally letting only {@code threadId} run meanwhile. */
    public CommandResult stepOut(Integer threadId, boolean singleThread) {
        var selected = selectThread(threadId);
        if (!selected.success) return selected;
        var locking = gdb.sendChecked("set scheduler-locking " + (singleThread ? "on" : "off"));
        if (!locking.success) return locking;
        return gdb.sendChecked("finish &");
    }

    private CommandResult selectThread(Integer threadId) {
        if (threadId == null) return CommandResult.ok();
        return gdb.sendChecked("-thread-select " + threadId);
    }

    public CommandResult selectFrame(int frameId) {
        return gdb.sendChecked("-stack-select-frame " + frameId);
    }

    /** Whether the selected frame has any arguments or locals. */
    public boolean hasLocals() {
        var listed = MiRecord.done(gdb.send("-stack-list-variables --no-values"));
        return listed.isPresent() && array(listed.get(), "variables").size() > 0;
    }

    public boolean hasRegisters() {
        var listed = MiRecord.done(gdb.send("-data-list-register-names"));
        return listed.isPresent() && array(listed.get(), "register-names").size() > 0;
    }

    /**
     * Evaluate {@code expression}. From the debug console it runs as a gdb command and the console output is the
     * result; anywhere else it is evaluated as an expression in the selected frame.
     */
    public String evaluate(String expression, String context) {
        if ("repl".equals(context)) {
            var records = gdb.send(expression);
            CommandResult.of(records).check();
            var output = new StringBuilder();
            for (var r : records) {
                if (r.kind == MiRecord.Kind.CONSOLE) output.append(r.payloadText());
            }
            return output.toString().stripTrailing();
        }
        var escaped = expression.replace("\\", "\\\\").replace("\"", "\\\"");
        var records = gdb.send("-data-evaluate-expression \"" + escaped + "\"");
        CommandResult.of(records).check();
        return string(MiRecord.done(records).orElse(new JsonObject()), "value", "");
    }

    public CommandResult loadExecutable(String path) {
        return gdb.sendChecked("file " + path);
    }

    public CommandResult setProgramArguments(List<String> args) {
        var quoted = new ArrayList<String>();
        for (var a : args) quoted.add(shellQuote(a));
        return gdb.sendChecked(("set args " + Joiner.on(' ').join(quoted)).trim());
    }

    static String shellQuote(String arg) {
        if (arg.isEmpty()) return "''";
        if (SHELL_SAFE.matcher(arg).matches()) return arg;
        return "'" + arg.replace("'", "'\"'\"'") + "'";
    }

    public CommandResult run() {
        return gdb.sendChecked("-exec-run");
    }
}
