package org.gdbdap.mi;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Optional;

/** Lenient accessors for mi payloads, where every scalar is a string and fields come and go between gdb versions. */
public class MiFields {
    public static String string(JsonObject tuple, String key, String fallback) {
        var value = tuple.get(key);
        if (value == null || !value.isJsonPrimitive()) return fallback;
        return value.getAsString();
    }

    public static Optional<String> string(JsonObject tuple, String key) {
        return Optional.ofNullable(string(tuple, key, null));
    }

    public static Optional<Integer> integer(JsonObject tuple, String key) {
        var value = string(tuple, key, null);
        if (value == null) return Optional.empty();
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static int integer(JsonObject tuple, String key, int fallback) {
        return integer(tuple, key).orElse(fallback);
    }

    /** The array under {@code key}. A lone tuple where a list was expected is wrapped. */
    public static JsonArray array(JsonObject tuple, String key) {
        var value = tuple.get(key);
        if (value == null) return new JsonArray();
        if (value.isJsonArray()) return value.getAsJsonArray();
        var single = new JsonArray();
        single.add(value);
        return single;
    }

    public static JsonObject object(JsonObject tuple, String key) {
        var value = tuple.get(key);
        if (value == null || !value.isJsonObject()) return new JsonObject();
        return value.getAsJsonObject();
    }

    public static JsonObject object(JsonElement element) {
        if (element == null || !element.isJsonObject()) return new JsonObject();
        return element.getAsJsonObject();
    }
}
