package org.gdbdap.debug;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client connection. Requests are read and served one at a time on the calling thread; events may be written
 * from any thread through {@link #client()}.
 */
public class DAP {
    private static final Gson gson = new Gson();
    static final int INVALID_JSON = -32700;

    private final ReadableByteChannel receive;
    private final WritableByteChannel send;
    private final Object writeLock = new Object();
    private int seq = 1;

    public DAP(ReadableByteChannel receive, WritableByteChannel send) {
        this.receive = receive;
        this.send = send;
    }

    void write(ProtocolMessage message) {
        synchronized (writeLock) {
            message.seq = seq++;
            var buffer = ByteBuffer.wrap(Framer.encode(message));
            try {
                while (buffer.hasRemaining()) send.write(buffer);
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }
    }

    private void event(String name, Object body) {
        var evt = new Event();
        evt.event = name;
        if (body != null) evt.body = gson.toJsonTree(body).getAsJsonObject();
        LOG.fine("Send event " + name);
        write(evt);
    }

    private class RealClient implements DebugClient {
        @Override
        public void initialized() {
            event("initialized", null);
        }

        @Override
        public void stopped(StoppedEventBody evt) {
            event("stopped", evt);
        }

        @Override
        public void continued(ContinuedEventBody evt) {
            event("continued", evt);
        }

        @Override
        public void invalidated(InvalidatedEventBody evt) {
            event("invalidated", evt);
        }

        @Override
        public void newProcess() {
            event("newProcess", null);
        }

        @Override
        public void exitedProcess() {
            event("exitedProcess", null);
        }
    }

    public DebugClient client() {
        return new RealClient();
    }

    /** Serve requests until the client closes the connection. */
    public void serve(DebugServer server) {
        var framer = new Framer();
        var buffer = ByteBuffer.allocate(8192);
        while (true) {
            buffer.clear();
            int n;
            try {
                n = receive.read(buffer);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to read from client", e);
                return;
            }
            if (n == -1) {
                LOG.info("Client closed the connection");
                return;
            }
            for (var decoded : framer.feed(Arrays.copyOf(buffer.array(), n))) {
                if (decoded.error.isPresent()) {
                    LOG.warning("Dropped frame: " + decoded.error.get());
                    write(invalidJson(decoded.error.get()));
                } else {
                    dispatch(server, decoded.message.get());
                }
            }
        }
    }

    private void dispatch(DebugServer server, JsonObject json) {
        // Clients that leave out 'type' still expect an answer
        var type = stringField(json, "type", "request");
        if (!type.equals("request")) {
            if (!json.has("command")) {
                LOG.warning("Ignored " + type + " message from client");
                return;
            }
            write(failed(json, "Unsupported message type: " + type));
            return;
        }
        Request request;
        try {
            request = gson.fromJson(json, Request.class);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, e.getMessage(), e);
            write(failed(json, e.getMessage()));
            return;
        }
        LOG.info("Handle " + request.command);
        List<ProtocolMessage> replies;
        try {
            replies = server.handle(request);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, e.getMessage(), e);
            write(failed(json, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
            return;
        }
        for (var m : replies) write(m);
    }

    private static Response failed(JsonObject request, String message) {
        var resp = new Response();
        resp.request_seq = intField(request, "seq");
        resp.command = stringField(request, "command", "unknown");
        resp.success = false;
        resp.message = message;
        return resp;
    }

    private static int intField(JsonObject json, String key) {
        JsonElement value = json.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) return 0;
        return value.getAsInt();
    }

    private static String stringField(JsonObject json, String key, String fallback) {
        JsonElement value = json.get(key);
        if (value == null || !value.isJsonPrimitive()) return fallback;
        return value.getAsString();
    }

    static Response invalidJson(String error) {
        var details = new Message();
        details.id = INVALID_JSON;
        details.format = error;
        var body = new ErrorResponse.Body();
        body.error = details;

        var resp = new ErrorResponse();
        resp.command = "unknown";
        resp.success = false;
        resp.message = error;
        resp.body = gson.toJsonTree(body);
        return resp;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
