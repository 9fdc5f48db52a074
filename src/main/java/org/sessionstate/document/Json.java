package org.sessionstate.document;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fail-closed access to the Gson tree that backs the state document.
 * <p>
 * Every getter returns {@link Optional#empty()} when the parent is missing,
 * the key is absent or the value has another type; nothing here throws on a
 * malformed document. Builders mirror the shapes used by the serializer.
 */
public final class Json {

    private Json() {}

    public static Optional<String> string(JsonObject obj, String key) {
        JsonElement e = get(obj, key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString()) {
            return Optional.of(e.getAsString());
        }
        return Optional.empty();
    }

    public static Optional<Boolean> bool(JsonObject obj, String key) {
        JsonElement e = get(obj, key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean()) {
            return Optional.of(e.getAsBoolean());
        }
        return Optional.empty();
    }

    /** Numbers are truncated towards zero the way a C cast would do it. */
    public static Optional<Integer> integer(JsonObject obj, String key) {
        return number(obj, key).map(n -> (int) n.doubleValue());
    }

    public static Optional<Long> longValue(JsonObject obj, String key) {
        return number(obj, key).map(n -> (long) n.doubleValue());
    }

    public static Optional<Number> number(JsonObject obj, String key) {
        JsonElement e = get(obj, key);
        if (e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber()) {
            return Optional.of(e.getAsNumber());
        }
        return Optional.empty();
    }

    public static Optional<JsonArray> array(JsonObject obj, String key) {
        JsonElement e = get(obj, key);
        return e != null && e.isJsonArray() ? Optional.of(e.getAsJsonArray()) : Optional.empty();
    }

    public static Optional<JsonObject> object(JsonObject obj, String key) {
        JsonElement e = get(obj, key);
        return e != null && e.isJsonObject() ? Optional.of(e.getAsJsonObject()) : Optional.empty();
    }

    /** @return element {@code index} of the array if it is an object. */
    public static Optional<JsonObject> objectAt(JsonArray arr, int index) {
        if (arr == null || index < 0 || index >= arr.size()) {
            return Optional.empty();
        }
        JsonElement e = arr.get(index);
        return e.isJsonObject() ? Optional.of(e.getAsJsonObject()) : Optional.empty();
    }

    /** @return element {@code index} of the array if it is a string. */
    public static Optional<String> stringAt(JsonArray arr, int index) {
        if (arr == null || index < 0 || index >= arr.size()) {
            return Optional.empty();
        }
        JsonElement e = arr.get(index);
        if (e.isJsonPrimitive() && e.getAsJsonPrimitive().isString()) {
            return Optional.of(e.getAsString());
        }
        return Optional.empty();
    }

    /** @return string elements of the array in order, skipping other types. */
    public static List<String> strings(JsonArray arr) {
        List<String> out = new ArrayList<>();
        if (arr == null) {
            return out;
        }
        for (int i = 0; i < arr.size(); i++) {
            stringAt(arr, i).ifPresent(out::add);
        }
        return out;
    }

    /** @return number of elements, {@code 0} for a missing array. */
    public static int size(JsonArray arr) {
        return arr == null ? 0 : arr.size();
    }

    /** Replaces (or creates) an array under {@code key} and returns it. */
    public static JsonArray addArray(JsonObject obj, String key) {
        JsonArray arr = new JsonArray();
        obj.add(key, arr);
        return arr;
    }

    /** Replaces (or creates) an object under {@code key} and returns it. */
    public static JsonObject addObject(JsonObject obj, String key) {
        JsonObject child = new JsonObject();
        obj.add(key, child);
        return child;
    }

    /** Appends a fresh object to the array and returns it. */
    public static JsonObject appendObject(JsonArray arr) {
        JsonObject child = new JsonObject();
        arr.add(child);
        return child;
    }

    /** Sets an integral number; avoids Gson printing whole numbers in exponent form. */
    public static void setLong(JsonObject obj, String key, long value) {
        obj.add(key, new JsonPrimitive(value));
    }

    private static JsonElement get(JsonObject obj, String key) {
        if (obj == null) {
            return null;
        }
        JsonElement e = obj.get(key);
        return e == null || e.isJsonNull() ? null : e;
    }
}
