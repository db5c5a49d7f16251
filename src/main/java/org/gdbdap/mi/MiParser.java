package org.gdbdap.mi;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Parses gdb/mi output lines.
 *
 * <p>Tuples become objects and lists become arrays. A list of {@code name=value} results keeps only the values, so
 * {@code stack=[frame={...},frame={...}]} becomes an array of frame objects. When a tuple repeats a name the values
 * are collected into an array.
 */
public class MiParser {
    private final String line;
    private int pos;

    private MiParser(String line) {
        this.line = line;
    }

    /** Parse one line. Empty for blank lines and the {@code (gdb)} prompt. */
    public static Optional<MiRecord> parse(String line) {
        var trimmed = line.stripTrailing();
        if (trimmed.isEmpty() || trimmed.equals("(gdb)")) return Optional.empty();
        try {
            return Optional.of(new MiParser(trimmed).record());
        } catch (MalformedRecordException e) {
            LOG.fine(String.format("Unparseable mi output at %d: %s", e.position, trimmed));
            return Optional.of(MiRecord.stream(MiRecord.Kind.OTHER, trimmed));
        }
    }

    private MiRecord record() {
        var token = token();
        if (pos >= line.length()) throw error();
        var c = line.charAt(pos++);
        switch (c) {
            case '^':
                return new MiRecord(MiRecord.Kind.RESULT, asyncClass(), results(), token);
            case '*':
            case '=':
                return new MiRecord(MiRecord.Kind.NOTIFY, asyncClass(), results(), token);
            case '~':
                return stream(MiRecord.Kind.CONSOLE);
            case '@':
                return stream(MiRecord.Kind.TARGET);
            case '&':
                return stream(MiRecord.Kind.LOG);
            default:
                // Status records (+download) and program output
                return MiRecord.stream(MiRecord.Kind.OTHER, line);
        }
    }

    private MiRecord stream(MiRecord.Kind kind) {
        var text = cString();
        if (pos != line.length()) throw error();
        return MiRecord.stream(kind, text);
    }

    private Long token() {
        var start = pos;
        while (pos < line.length() && Character.isDigit(line.charAt(pos))) pos++;
        if (start == pos) return null;
        try {
            return Long.parseLong(line.substring(start, pos));
        } catch (NumberFormatException e) {
            throw error();
        }
    }

    private String asyncClass() {
        var start = pos;
        while (pos < line.length() && line.charAt(pos) != ',') pos++;
        if (start == pos) throw error();
        return line.substring(start, pos);
    }

    private JsonObject results() {
        var results = new JsonObject();
        var repeated = new HashSet<String>();
        while (pos < line.length()) {
            expect(',');
            result(results, repeated);
        }
        return results;
    }

    private void result(JsonObject into, Set<String> repeated) {
        var name = variable();
        expect('=');
        var value = value();
        if (!into.has(name)) {
            into.add(name, value);
        } else if (repeated.contains(name)) {
            into.getAsJsonArray(name).add(value);
        } else {
            var all = new JsonArray();
            all.add(into.get(name));
            all.add(value);
            into.add(name, all);
            repeated.add(name);
        }
    }

    private String variable() {
        var start = pos;
        while (pos < line.length() && line.charAt(pos) != '=') pos++;
        if (start == pos || pos == line.length()) throw error();
        return line.substring(start, pos);
    }

    private JsonElement value() {
        switch (peek()) {
            case '"':
                return new JsonPrimitive(cString());
            case '{':
                return tuple();
            case '[':
                return list();
            default:
                throw error();
        }
    }

    private JsonObject tuple() {
        expect('{');
        var tuple = new JsonObject();
        var repeated = new HashSet<String>();
        if (peek() == '}') {
            pos++;
            return tuple;
        }
        while (true) {
            result(tuple, repeated);
            if (peek() == '}') {
                pos++;
                return tuple;
            }
            expect(',');
        }
    }

    private JsonArray list() {
        expect('[');
        var list = new JsonArray();
        if (peek() == ']') {
            pos++;
            return list;
        }
        while (true) {
            var c = peek();
            if (c == '"' || c == '{' || c == '[') {
                list.add(value());
            } else {
                variable();
                expect('=');
                list.add(value());
            }
            if (peek() == ']') {
                pos++;
                return list;
            }
            expect(',');
        }
    }

    private String cString() {
        expect('"');
        var bytes = new ByteArrayOutputStream();
        while (true) {
            if (pos >= line.length()) throw error();
            var c = line.charAt(pos++);
            if (c == '"') break;
            if (c != '\\') {
                var utf8 = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                if (Character.isHighSurrogate(c) && pos < line.length()) {
                    utf8 = line.substring(pos - 1, pos + 1).getBytes(StandardCharsets.UTF_8);
                    pos++;
                }
                bytes.writeBytes(utf8);
                continue;
            }
            if (pos >= line.length()) throw error();
            var e = line.charAt(pos++);
            switch (e) {
                case 'n':
                    bytes.write('\n');
                    break;
                case 't':
                    bytes.write('\t');
                    break;
                case 'r':
                    bytes.write('\r');
                    break;
                case 'f':
                    bytes.write('\f');
                    break;
                case 'b':
                    bytes.write('\b');
                    break;
                case 'a':
                    bytes.write(7);
                    break;
                case 'v':
                    bytes.write(11);
                    break;
                case 'e':
                    bytes.write(27);
                    break;
                default:
                    if (e >= '0' && e <= '7') {
                        // Octal byte, up to three digits; gdb escapes non-ascii utf-8 this way
                        var value = e - '0';
                        for (var i = 0; i < 2 && pos < line.length(); i++) {
                            var d = line.charAt(pos);
                            if (d < '0' || d > '7') break;
                            value = value * 8 + (d - '0');
                            pos++;
                        }
                        bytes.write(value & 0xff);
                    } else {
                        bytes.writeBytes(String.valueOf(e).getBytes(StandardCharsets.UTF_8));
                    }
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private char peek() {
        if (pos >= line.length()) throw error();
        return line.charAt(pos);
    }

    private void expect(char c) {
        if (peek() != c) throw error();
        pos++;
    }

    private MalformedRecordException error() {
        return new MalformedRecordException(pos);
    }

    private static class MalformedRecordException extends RuntimeException {
        final int position;

        MalformedRecordException(int position) {
            super(null, null, false, false);
            this.position = position;
        }
    }

    private static final Logger LOG = Logger.getLogger("main");
}
