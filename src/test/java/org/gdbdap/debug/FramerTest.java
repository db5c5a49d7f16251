package org.gdbdap.debug;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import com.google.common.base.Charsets;
import com.google.common.primitives.Bytes;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class FramerTest {
    static final Gson gson = new Gson();

    static byte[] frame(String json) {
        var body = json.getBytes(Charsets.UTF_8);
        var header = String.format("Content-Length: %d\r\n\r\n", body.length).getBytes(Charsets.UTF_8);
        return Bytes.concat(header, body);
    }

    static byte[] bytes(String text) {
        return text.getBytes(Charsets.UTF_8);
    }

    @Test
    public void encode() {
        var evt = new Event();
        evt.seq = 7;
        evt.event = "initialized";
        var expected = "Content-Length: 56\r\n\r\n{\"event\":\"initialized\",\"body\":{},\"seq\":7,\"type\":\"event\"}";
        assertThat(new String(Framer.encode(evt), Charsets.UTF_8), equalTo(expected));
    }

    @Test
    public void encodeCountsBytesNotChars() {
        var encoded = new String(Framer.encode("🔥"), Charsets.UTF_8);
        assertThat(encoded, equalTo("Content-Length: 6\r\n\r\n\"🔥\""));
    }

    @Test
    public void decodeWhatWasEncoded() {
        var resp = new Response();
        resp.seq = 3;
        resp.request_seq = 2;
        resp.command = "threads";
        resp.success = true;
        resp.message = "ü";

        var decoded = Framer.decode(Framer.encode(resp));

        assertThat(decoded.message.get(), equalTo(gson.toJsonTree(resp)));
        assertThat(decoded.remaining.length, equalTo(0));
    }

    @Test
    public void incompleteHeader() {
        var partial = bytes("Content-Length: 10\r\n");
        var decoded = Framer.decode(partial);
        assertFalse(decoded.isComplete());
        assertThat(decoded.remaining, equalTo(partial));
    }

    @Test
    public void incompleteBody() {
        var partial = bytes("Content-Length: 10\r\n\r\n{\"a\":");
        var decoded = Framer.decode(partial);
        assertFalse(decoded.isComplete());
        assertThat(decoded.remaining, equalTo(partial));
    }

    @Test
    public void twoFramesInOneBuffer() {
        var buffer = Bytes.concat(frame("{\"seq\":1}"), frame("{\"seq\":2}"));

        var first = Framer.decode(buffer);
        var second = Framer.decode(first.remaining);

        assertThat(first.message.get().get("seq").getAsInt(), equalTo(1));
        assertThat(second.message.get().get("seq").getAsInt(), equalTo(2));
        assertThat(second.remaining.length, equalTo(0));
    }

    @Test
    public void badJsonDropsOnlyThatFrame() {
        var buffer = Bytes.concat(frame("{bad json"), frame("{\"seq\":2}"));

        var first = Framer.decode(buffer);
        assertFalse(first.message.isPresent());
        assertThat(first.error.get(), startsWith("Invalid JSON format"));

        var second = Framer.decode(first.remaining);
        assertThat(second.message.get().get("seq").getAsInt(), equalTo(2));
    }

    @Test
    public void lenientJsonIsRejected() {
        for (var body : List.of("{seq:1,command:'threads'}", "{\"seq\":1} {\"seq\":2}", "{\"seq\":1,}")) {
            var decoded = Framer.decode(frame(body));
            assertTrue(body, decoded.isComplete());
            assertFalse(body, decoded.message.isPresent());
            assertThat(body, decoded.error.get(), startsWith("Invalid JSON format"));
        }
    }

    @Test
    public void jsonMustBeAnObject() {
        var decoded = Framer.decode(frame("[1,2]"));
        assertThat(decoded.error.get(), startsWith("Invalid JSON format"));
    }

    @Test
    public void headerWithoutLengthIsDropped() {
        var buffer = Bytes.concat(bytes("Content-Type: application/json\r\n\r\n"), frame("{\"seq\":5}"));

        var first = Framer.decode(buffer);
        assertThat(first.error.get(), equalTo("Missing Content-Length header"));

        var second = Framer.decode(first.remaining);
        assertThat(second.message.get().get("seq").getAsInt(), equalTo(5));
    }

    @Test
    public void extraHeadersAndCase() {
        var body = "{\"seq\":9}";
        var buffer = bytes("content-length: " + body.length() + "\r\nContent-Type: application/vscode-jsonrpc\r\n\r\n" + body);
        assertThat(Framer.decode(buffer).message.get().get("seq").getAsInt(), equalTo(9));
    }

    @Test
    public void strayLineBreaksBetweenFrames() {
        var buffer = Bytes.concat(bytes("\r\n"), frame("{\"seq\":4}"));
        assertThat(Framer.decode(buffer).message.get().get("seq").getAsInt(), equalTo(4));
    }

    @Test
    public void splitFeedMatchesWholeFeed() {
        var stream =
                Bytes.concat(
                        frame("{\"seq\":1,\"type\":\"request\",\"command\":\"initialize\"}"),
                        frame("{not json}"),
                        frame("{\"seq\":2,\"type\":\"request\",\"command\":\"threads\",\"arguments\":{\"text\":\"日本\"}}"));

        var whole = describe(new Framer().feed(stream));

        var framer = new Framer();
        var pieces = new ArrayList<Framer.Decoded>();
        for (var b : stream) pieces.addAll(framer.feed(new byte[] {b}));

        assertThat(describe(pieces), equalTo(whole));
        assertThat(whole, hasSize(3));
        assertThat(whole.get(2), containsString("日本"));
    }

    static List<String> describe(List<Framer.Decoded> decoded) {
        var result = new ArrayList<String>();
        for (var d : decoded) {
            if (d.message.isPresent()) result.add(d.message.get().toString());
            else result.add("error: " + d.error.get());
        }
        return result;
    }

    @Test
    public void feedKeepsPartialFrame() {
        var framer = new Framer();
        var full = frame("{\"seq\":1}");
        var head = Arrays.copyOfRange(full, 0, 10);
        var tail = Arrays.copyOfRange(full, 10, full.length);

        assertThat(framer.feed(head), empty());
        var decoded = framer.feed(tail);
        assertThat(decoded, hasSize(1));
        assertThat(decoded.get(0).message.get(), equalTo((JsonObject) JsonParser.parseString("{\"seq\":1}")));
    }
}
