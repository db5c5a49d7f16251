package org.gdbdap;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.gdbdap.mi.MiRecord;

/** Sends one gdb/mi command at a time and collects the records that answer it. */
public interface GdbBackend {
    /**
     * Send {@code command} and wait until a result record whose class is in {@code accepted} arrives.
     *
     * @return every record received for the command, the terminating result last. On timeout a single synthetic
     *     {@code ^error} record.
     * @throws BackendUnavailableException if gdb is not running
     */
    List<MiRecord> send(String command, Duration timeout, Set<String> accepted);

    /** {@link #send(String, Duration, Set)} with the default timeout and accepted classes. */
    List<MiRecord> send(String command);

    default CommandResult sendChecked(String command) {
        return sendChecked(command, false);
    }

    default CommandResult sendChecked(String command, boolean ignoreFailures) {
        var result = CommandResult.of(send(command));
        if (ignoreFailures) return CommandResult.ok();
        return result;
    }
}
