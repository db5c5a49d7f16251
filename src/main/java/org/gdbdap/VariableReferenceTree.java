package org.gdbdap;

import static org.gdbdap.mi.MiFields.*;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.Multimap;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.gdbdap.debug.Variable;
import org.gdbdap.mi.MiRecord;

/**
 * Hands out the integer handles the client uses to expand scopes and values.
 *
 * <p>Handles live in three fixed ranges. A locals or registers handle is the range base plus a frame id, so it needs no
 * state. A dynamic handle is bound to a gdb variable object; dynamic handles come from a counter and are never reused.
 */
public class VariableReferenceTree {
    public static final int NO_CHILDREN = 0;
    public static final int LOCALS_BASE = 100_000;
    public static final int REGISTERS_BASE = 200_000;
    public static final int DYNAMIC_BASE = 300_000;

    public enum Range {
        NONE,
        LOCALS,
        REGISTERS,
        DYNAMIC
    }

    private static final Pattern HEX = Pattern.compile("0x[0-9a-fA-F]+");

    private final GdbBackend gdb;
    private final Map<Integer, Binding> bindings = new HashMap<>();
    /** Display name to the root variable object created for it. */
    private final Map<String, String> roots = new HashMap<>();
    /** Root variable object to the dereference objects probed under it. */
    private final Multimap<String, String> derived = ArrayListMultimap.create();
    private int nextHandle = DYNAMIC_BASE;

    private static class Binding {
        final String object;
        final String root;

        Binding(String object, String root) {
            this.object = object;
            this.root = root;
        }
    }

    public VariableReferenceTree(GdbBackend gdb) {
        this.gdb = gdb;
    }

    public static Range rangeOf(int handle) {
        if (handle >= DYNAMIC_BASE) return Range.DYNAMIC;
        if (handle >= REGISTERS_BASE) return Range.REGISTERS;
        if (handle >= LOCALS_BASE) return Range.LOCALS;
        return Range.NONE;
    }

    public static int localsHandle(int frameId) {
        checkFrame(frameId);
        return LOCALS_BASE + frameId;
    }

    public static int registersHandle(int frameId) {
        checkFrame(frameId);
        return REGISTERS_BASE + frameId;
    }

    private static void checkFrame(int frameId) {
        if (frameId < 0 || frameId >= REGISTERS_BASE - LOCALS_BASE) {
            throw new IllegalArgumentException("Frame id out of range: " + frameId);
        }
    }

    /** The variables one level below {@code handle}. */
    public List<Variable> resolve(int handle) {
        switch (rangeOf(handle)) {
            case LOCALS:
                return locals(handle - LOCALS_BASE);
            case REGISTERS:
                return registers(handle - REGISTERS_BASE);
            case DYNAMIC:
                {
                    var binding = bindings.get(handle);
                    if (binding == null) throw new NotFoundException("No variable for reference " + handle);
                    return children(binding);
                }
            default:
                throw new NotFoundException("No variable for reference " + handle);
        }
    }

    private List<Variable> locals(int frameId) {
        gdb.sendChecked("-stack-select-frame " + frameId).check();
        var records = gdb.send("-stack-list-variables --all-values");
        CommandResult.of(records).check();
        var result = new ArrayList<Variable>();
        for (var element : array(MiRecord.done(records).orElse(new JsonObject()), "variables")) {
            var local = object(element);
            var name = string(local, "name", "");
            var value = string(local, "value", "<unknown>");
            if (isComplex(value)) {
                var expanded = createForName(name);
                result.add(new Variable(name, value, expanded.variablesReference));
            } else {
                result.add(new Variable(name, value, NO_CHILDREN));
            }
        }
        return result;
    }

    private static boolean isComplex(String value) {
        if (value.contains("{") || value.contains("[")) return true;
        return HEX.matcher(value).matches() && !value.equals("0x0");
    }

    private List<Variable> registers(int frameId) {
        gdb.sendChecked("-stack-select-frame " + frameId).check();
        var namesReply = gdb.send("-data-list-register-names");
        CommandResult.of(namesReply).check();
        var names = array(MiRecord.done(namesReply).orElse(new JsonObject()), "register-names");
        var valuesReply = gdb.send("-data-list-register-values x");
        CommandResult.of(valuesReply).check();

        var result = new ArrayList<Variable>();
        for (var element : array(MiRecord.done(valuesReply).orElse(new JsonObject()), "register-values")) {
            var register = object(element);
            var number = integer(register, "number", -1);
            if (number < 0 || number >= names.size()) continue;
            var name = names.get(number).getAsString();
            if (name.isEmpty()) continue;
            result.add(new Variable(name, string(register, "value", ""), NO_CHILDREN));
        }
        return result;
    }

    /**
     * Create a variable object for {@code displayName}, replacing any earlier one for the same name.
     *
     * <p>The old object and every dereference probe made under it are deleted in gdb, and the handles bound to them stop
     * resolving.
     */
    public Variable createForName(String displayName) {
        supersede(displayName);
        var records = gdb.send("-var-create - * " + displayName);
        var created = MiRecord.done(records);
        if (created.isEmpty()) {
            LOG.warning("Failed to create variable object for " + displayName + ": " + CommandResult.of(records).message);
            return new Variable(displayName, "<unknown>", NO_CHILDREN);
        }
        var tuple = created.get();
        var object = string(tuple, "name", "");
        roots.put(displayName, object);
        var variable = new Variable(displayName, string(tuple, "value", ""), NO_CHILDREN);
        variable.type = string(tuple, "type", null);
        if (isExpandable(tuple)) variable.variablesReference = bind(object, object);
        return variable;
    }

    private void supersede(String displayName) {
        var old = roots.remove(displayName);
        if (old == null) return;
        for (var probe : derived.removeAll(old)) {
            gdb.sendChecked("-var-delete " + escape(probe), true);
        }
        gdb.sendChecked("-var-delete " + escape(old), true);
        bindings.values().removeIf(b -> b.root.equals(old));
    }

    private List<Variable> children(Binding parent) {
        var records = gdb.send("-var-list-children --all-values " + escape(parent.object));
        CommandResult.of(records).check();
        var result = new ArrayList<Variable>();
        for (var element : array(MiRecord.done(records).orElse(new JsonObject()), "children")) {
            var child = object(element);
            var object = string(child, "name", "");
            var exp = string(child, "exp", object);
            var variable = new Variable(exp, string(child, "value", ""), NO_CHILDREN);
            variable.type = string(child, "type", null);
            if (isExpandable(child)) variable.variablesReference = bind(object, parent.root);
            result.add(variable);
            if (isPointer(child)) dereference(object, exp, parent.root).ifPresent(result::add);
        }
        return result;
    }

    /** An entry for {@code *(exp)}, only when the pointed-to value has children of its own. */
    private Optional<Variable> dereference(String object, String exp, String root) {
        var path = MiRecord.done(gdb.send("-var-info-path-expression " + escape(object)));
        if (path.isEmpty() || !path.get().has("path_expr")) return Optional.empty();
        var probe = MiRecord.done(gdb.send("-var-create - * *(" + string(path.get(), "path_expr", "") + ")"));
        if (probe.isEmpty()) return Optional.empty();
        var probeObject = string(probe.get(), "name", "");
        if (integer(probe.get(), "numchild", 0) <= 0) {
            gdb.sendChecked("-var-delete " + escape(probeObject), true);
            return Optional.empty();
        }
        derived.put(root, probeObject);
        return Optional.of(new Variable("*(" + exp + ")", "", bind(probeObject, root)));
    }

    private int bind(String object, String root) {
        if (nextHandle == Integer.MAX_VALUE) throw new IllegalStateException("Ran out of variable references");
        var handle = nextHandle++;
        bindings.put(handle, new Binding(object, root));
        return handle;
    }

    static boolean isExpandable(JsonObject tuple) {
        return integer(tuple, "numchild", 0) > 0
                || string(tuple, "has_more", "0").equals("1")
                || string(tuple, "displayhint", "").equals("array");
    }

    static boolean isPointer(JsonObject child) {
        var type = string(child, "type", "").replace(" ", "");
        var value = string(child, "value", "");
        return type.contains("*")
                || HEX.matcher(value).matches()
                || value.equals("0x0")
                || value.equals("NULL")
                || value.equals("nullptr");
    }

    /** Quote a variable object name for use as an mi argument. */
    static String escape(String name) {
        return "\"" + name.replace(",", "\\,").replace("\"", "\\\"") + "\"";
    }

    private static final Logger LOG = Logger.getLogger("main");
}
