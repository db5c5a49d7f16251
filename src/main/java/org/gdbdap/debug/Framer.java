package org.gdbdap.debug;

import com.google.common.base.Charsets;
import com.google.common.primitives.Bytes;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Content-Length framing of protocol messages.
 *
 * <pre>
 * Content-Length: 119\r\n
 * \r\n
 * {"seq":153,"type":"request","command":"next","arguments":{"threadId":3}}
 * </pre>
 */
public class Framer {
    private static final Gson gson = new Gson();
    private static final TypeAdapter<JsonElement> JSON_ELEMENT = gson.getAdapter(JsonElement.class);
    private static final byte[] HEADER_END = "\r\n\r\n".getBytes(Charsets.US_ASCII);
    private static final String CONTENT_LENGTH = "content-length";

    private byte[] pending = new byte[0];

    public static class Decoded {
        public final Optional<JsonObject> message;
        public final Optional<String> error;
        /** Bytes after the decoded frame, or the whole input when no frame is complete yet. */
        public final byte[] remaining;

        private Decoded(Optional<JsonObject> message, Optional<String> error, byte[] remaining) {
            this.message = message;
            this.error = error;
            this.remaining = remaining;
        }

        static Decoded incomplete(byte[] buffer) {
            return new Decoded(Optional.empty(), Optional.empty(), buffer);
        }

        static Decoded message(JsonObject message, byte[] remaining) {
            return new Decoded(Optional.of(message), Optional.empty(), remaining);
        }

        static Decoded error(String error, byte[] remaining) {
            return new Decoded(Optional.empty(), Optional.of(error), remaining);
        }

        public boolean isComplete() {
            return message.isPresent() || error.isPresent();
        }
    }

    /** Decode the first frame in {@code buffer}. A frame with a bad header or bad JSON is dropped and reported. */
    public static Decoded decode(byte[] buffer) {
        // Tolerate stray line breaks between frames
        var start = 0;
        while (start < buffer.length && (buffer[start] == '\r' || buffer[start] == '\n')) start++;
        var headerEnd = indexOf(buffer, HEADER_END, start);
        if (headerEnd == -1) return Decoded.incomplete(buffer);
        var bodyStart = headerEnd + HEADER_END.length;

        var headers = new String(buffer, start, headerEnd - start, Charsets.US_ASCII);
        var length = contentLength(headers);
        if (length == -1) {
            return Decoded.error("Missing Content-Length header", Arrays.copyOfRange(buffer, bodyStart, buffer.length));
        }
        if (buffer.length - bodyStart < length) return Decoded.incomplete(buffer);

        var bodyEnd = bodyStart + length;
        var remaining = Arrays.copyOfRange(buffer, bodyEnd, buffer.length);
        var text = new String(buffer, bodyStart, length, Charsets.UTF_8);
        try {
            var json = parseStrict(text);
            if (!json.isJsonObject()) return Decoded.error("Invalid JSON format: expected an object", remaining);
            return Decoded.message(json.getAsJsonObject(), remaining);
        } catch (IOException | JsonParseException e) {
            return Decoded.error("Invalid JSON format: " + e.getMessage(), remaining);
        }
    }

    /** Unlike {@link com.google.gson.JsonParser}, rejects unquoted names, single quotes and trailing data. */
    private static JsonElement parseStrict(String text) throws IOException {
        var reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        var json = JSON_ELEMENT.read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new MalformedJsonException("Unexpected data after the message at " + reader.getPath());
        }
        return json;
    }

    private static int contentLength(String headers) {
        for (var line : headers.split("\r\n")) {
            var colon = line.indexOf(':');
            if (colon == -1) continue;
            if (!line.substring(0, colon).trim().equalsIgnoreCase(CONTENT_LENGTH)) continue;
            try {
                var length = Integer.parseInt(line.substring(colon + 1).trim());
                return length < 0 ? -1 : length;
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    private static int indexOf(byte[] buffer, byte[] target, int from) {
        var tail = Bytes.indexOf(Arrays.copyOfRange(buffer, from, buffer.length), target);
        return tail == -1 ? -1 : from + tail;
    }

    /** Append {@code bytes} to what is pending and decode every complete frame, in order. */
    public List<Decoded> feed(byte[] bytes) {
        pending = Bytes.concat(pending, bytes);
        var decoded = new ArrayList<Decoded>();
        while (true) {
            var next = decode(pending);
            if (!next.isComplete()) break;
            decoded.add(next);
            pending = next.remaining;
        }
        return decoded;
    }

    public static byte[] encode(Object message) {
        var body = gson.toJson(message).getBytes(Charsets.UTF_8);
        var header = String.format("Content-Length: %d\r\n\r\n", body.length).getBytes(Charsets.US_ASCII);
        return Bytes.concat(header, body);
    }
}
