package org.gdbdap.debug;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import com.google.common.primitives.Bytes;
import com.google.gson.JsonObject;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class DAPTest {
    ByteArrayOutputStream sent = new ByteArrayOutputStream();
    List<String> handled = new ArrayList<>();

    DebugServer echo =
            request -> {
                handled.add(request.command);
                if (request.command.equals("explode")) throw new IllegalStateException("handler blew up");
                var resp = new Response();
                resp.request_seq = request.seq;
                resp.command = request.command;
                resp.success = true;
                var evt = new Event();
                evt.event = "handled";
                return List.of(resp, evt);
            };

    DAP connect(byte[] input) {
        return new DAP(Channels.newChannel(new ByteArrayInputStream(input)), Channels.newChannel(sent));
    }

    List<JsonObject> written() {
        var result = new ArrayList<JsonObject>();
        for (var d : new Framer().feed(sent.toByteArray())) result.add(d.message.get());
        return result;
    }

    static byte[] request(int seq, String command) {
        return FramerTest.frame(
                String.format("{\"seq\":%d,\"type\":\"request\",\"command\":\"%s\",\"arguments\":{}}", seq, command));
    }

    @Test
    public void badFrameThenGoodRequest() {
        var input = Bytes.concat(FramerTest.frame("{bad json"), request(1, "initialize"));

        connect(input).serve(echo);

        var out = written();
        assertThat(out, hasSize(3));
        var error = out.get(0);
        assertThat(error.get("type").getAsString(), equalTo("response"));
        assertFalse(error.get("success").getAsBoolean());
        assertThat(error.get("command").getAsString(), equalTo("unknown"));
        assertThat(error.get("message").getAsString(), startsWith("Invalid JSON format"));
        assertThat(error.getAsJsonObject("body").getAsJsonObject("error").get("id").getAsInt(), equalTo(-32700));

        var response = out.get(1);
        assertThat(response.get("command").getAsString(), equalTo("initialize"));
        assertThat(response.get("request_seq").getAsInt(), equalTo(1));
        assertTrue(response.get("success").getAsBoolean());
        assertThat(out.get(2).get("event").getAsString(), equalTo("handled"));
        assertThat(handled, contains("initialize"));
    }

    @Test
    public void outgoingSeqIncreases() {
        connect(Bytes.concat(request(1, "threads"), request(2, "threads"))).serve(echo);

        var out = written();
        assertThat(out, hasSize(4));
        for (var i = 0; i < out.size(); i++) {
            assertThat(out.get(i).get("seq").getAsInt(), equalTo(i + 1));
        }
    }

    @Test
    public void handlerFailureIsAFailedResponse() {
        connect(Bytes.concat(request(5, "explode"), request(6, "threads"))).serve(echo);

        var out = written();
        var failed = out.get(0);
        assertFalse(failed.get("success").getAsBoolean());
        assertThat(failed.get("command").getAsString(), equalTo("explode"));
        assertThat(failed.get("request_seq").getAsInt(), equalTo(5));
        assertThat(failed.get("message").getAsString(), equalTo("handler blew up"));
        assertThat(out.get(1).get("request_seq").getAsInt(), equalTo(6));
    }

    @Test
    public void requestWithoutTypeIsHandled() {
        connect(FramerTest.frame("{\"seq\":1,\"command\":\"threads\",\"arguments\":{}}")).serve(echo);

        assertThat(handled, contains("threads"));
        var out = written();
        assertThat(out, hasSize(2));
        assertThat(out.get(0).get("request_seq").getAsInt(), equalTo(1));
        assertTrue(out.get(0).get("success").getAsBoolean());
    }

    @Test
    public void otherTypeWithCommandIsAnswered() {
        connect(FramerTest.frame("{\"seq\":4,\"type\":\"response\",\"command\":\"runInTerminal\"}")).serve(echo);

        assertThat(handled, empty());
        var out = written();
        assertThat(out, hasSize(1));
        assertFalse(out.get(0).get("success").getAsBoolean());
        assertThat(out.get(0).get("request_seq").getAsInt(), equalTo(4));
        assertThat(out.get(0).get("command").getAsString(), equalTo("runInTerminal"));
        assertThat(out.get(0).get("message").getAsString(), equalTo("Unsupported message type: response"));
    }

    @Test
    public void eventsFromClientAreIgnored() {
        connect(FramerTest.frame("{\"seq\":1,\"type\":\"event\",\"event\":\"bogus\"}")).serve(echo);
        assertThat(handled, empty());
        assertThat(written(), empty());
    }

    @Test
    public void clientEvents() {
        var dap = connect(new byte[0]);
        var client = dap.client();
        client.stopped(new StoppedEventBody("breakpoint", 2, false, List.of(4)));
        client.newProcess();

        var out = written();
        assertThat(out, hasSize(2));
        var stopped = out.get(0);
        assertThat(stopped.get("type").getAsString(), equalTo("event"));
        assertThat(stopped.get("event").getAsString(), equalTo("stopped"));
        assertThat(stopped.getAsJsonObject("body").get("threadId").getAsInt(), equalTo(2));
        assertThat(stopped.getAsJsonObject("body").getAsJsonArray("hitBreakpointIds").get(0).getAsInt(), equalTo(4));
        assertThat(out.get(1).get("event").getAsString(), equalTo("newProcess"));
        assertThat(out.get(1).get("seq").getAsInt(), equalTo(2));
    }
}
