package org.gdbdap.debug;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/** Response for a request. */
public class Response extends ProtocolMessage {
    // type: 'response';
    /** Sequence number of the corresponding request. */
    public int request_seq;
    /** Outcome of the request. */
    public boolean success;
    /** The command requested. */
    public String command;
    /** Contains error message if success == false. */
    public String message = "";
    /** Contains request result if success is true and optional error details if success is false. */
    public JsonElement body = new JsonObject();

    public Response() {
        type = "response";
    }
}
