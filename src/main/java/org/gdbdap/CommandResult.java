package org.gdbdap;

import java.util.List;
import org.gdbdap.mi.MiRecord;

public class CommandResult {
    public final boolean success;
    public final String message;

    public CommandResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static CommandResult ok() {
        return new CommandResult(true, "");
    }

    public static CommandResult ok(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult failed(String message) {
        return new CommandResult(false, message);
    }

    /** Fails on the first {@code ^error} record, succeeds otherwise. */
    public static CommandResult of(List<MiRecord> records) {
        for (var r : records) {
            if (r.isResult("error")) {
                var msg = r.payloadObject().get("msg");
                var text = msg == null ? "Unknown error" : msg.getAsString();
                return failed("Error from GDB: " + text);
            }
        }
        return ok();
    }

    /** Throws {@link CommandFailedException} unless this result is a success. */
    public CommandResult check() {
        if (!success) throw new CommandFailedException(this);
        return this;
    }

    @Override
    public String toString() {
        return success ? "ok" : "failed: " + message;
    }
}
