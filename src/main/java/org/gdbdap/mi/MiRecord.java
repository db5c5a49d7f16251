package org.gdbdap.mi;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One line of gdb/mi output.
 *
 * <p>RESULT and NOTIFY records carry a {@link JsonObject} payload built from the mi results. CONSOLE, TARGET and LOG
 * records carry the unescaped stream text. OTHER records carry the raw line.
 */
public class MiRecord {
    public enum Kind {
        /** {@code ^done}, {@code ^error}, {@code ^running}, {@code ^connected}, {@code ^exit} */
        RESULT,
        /** {@code *stopped}, {@code *running}, {@code =thread-group-added}, ... */
        NOTIFY,
        /** {@code ~"..."} */
        CONSOLE,
        /** {@code @"..."} */
        TARGET,
        /** {@code &"..."} */
        LOG,
        OTHER
    }

    public final Kind kind;
    /** Result or async class, e.g. "done" or "stopped". Null for stream records. */
    public final String message;
    public final JsonElement payload;
    public final Long token;

    public MiRecord(Kind kind, String message, JsonElement payload, Long token) {
        this.kind = Objects.requireNonNull(kind);
        this.message = message;
        this.payload = payload;
        this.token = token;
    }

    /** A synthetic {@code ^error} record, used for timeouts. */
    public static MiRecord error(String msg) {
        var payload = new JsonObject();
        payload.addProperty("msg", msg);
        return new MiRecord(Kind.RESULT, "error", payload, null);
    }

    public static MiRecord stream(Kind kind, String text) {
        return new MiRecord(kind, null, new JsonPrimitive(text), null);
    }

    public boolean isResult(String resultClass) {
        return kind == Kind.RESULT && resultClass.equals(message);
    }

    public boolean isNotify(String asyncClass) {
        return kind == Kind.NOTIFY && asyncClass.equals(message);
    }

    /** The payload of a result or notify record; an empty object for anything else. */
    public JsonObject payloadObject() {
        if (payload != null && payload.isJsonObject()) return payload.getAsJsonObject();
        return new JsonObject();
    }

    /** The text of a stream record; empty for anything else. */
    public String payloadText() {
        if (payload != null && payload.isJsonPrimitive()) return payload.getAsString();
        return "";
    }

    /** Payload of the first {@code ^done} record, if gdb sent one. */
    public static Optional<JsonObject> done(List<MiRecord> records) {
        for (var r : records) {
            if (r.isResult("done")) return Optional.of(r.payloadObject());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        var prefix = token == null ? "" : token.toString();
        if (message == null) return prefix + kind + " " + payload;
        return prefix + kind + " " + message + " " + payload;
    }
}
