package com.amannmalik.ucp.codec;

import com.amannmalik.ucp.api.shared.MinorUnitAmount;
import jakarta.json.*;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

final class JsonSupport {
    private JsonSupport() {
    }

    private static boolean absent(JsonObject parent, String key) {
        return !parent.containsKey(key) || parent.isNull(key);
    }

    static JsonObject optionalObject(JsonObject parent, String key) {
        if (absent(parent, key)) {
            return null;
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new JsonDecodingException("Expected object at: " + key);
        }
        return value.asJsonObject();
    }

    static JsonArray optionalArray(JsonObject parent, String key) {
        if (absent(parent, key)) {
            return JsonValue.EMPTY_JSON_ARRAY;
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.ARRAY) {
            throw new JsonDecodingException("Expected array at: " + key);
        }
        return value.asJsonArray();
    }

    static <T> List<T> mapObjects(JsonObject parent, String key, Function<JsonObject, T> mapper) {
        var array = optionalArray(parent, key);
        var result = new ArrayList<T>(array.size());
        for (var index = 0; index < array.size(); index++) {
            var value = array.get(index);
            if (value.getValueType() != JsonValue.ValueType.OBJECT) {
                throw new JsonDecodingException("Expected object at: " + key + "[" + index + "]");
            }
            result.add(mapper.apply(value.asJsonObject()));
        }
        return List.copyOf(result);
    }

    static List<JsonObject> objects(JsonObject parent, String key) {
        return mapObjects(parent, key, Function.identity());
    }

    static List<String> strings(JsonObject parent, String key) {
        var array = optionalArray(parent, key);
        var result = new ArrayList<String>(array.size());
        for (var index = 0; index < array.size(); index++) {
            var value = array.get(index);
            if (value.getValueType() != JsonValue.ValueType.STRING) {
                throw new JsonDecodingException("Expected string at: " + key + "[" + index + "]");
            }
            result.add(((JsonString) value).getString());
        }
        return List.copyOf(result);
    }

    static String requireString(JsonObject parent, String key) {
        if (absent(parent, key)) {
            throw new JsonDecodingException("Missing string: " + key);
        }
        var string = optionalStringAllowBlank(parent, key);
        if (string.isBlank()) {
            throw new JsonDecodingException("String MUST be non-blank: " + key);
        }
        return string;
    }

    /// Absent and blank both read as {@code null}.
    static String optionalString(JsonObject parent, String key) {
        var string = optionalStringAllowBlank(parent, key);
        return string == null || string.isBlank() ? null : string;
    }

    static String optionalStringAllowBlank(JsonObject parent, String key) {
        if (absent(parent, key)) {
            return null;
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JsonDecodingException("Expected string at: " + key);
        }
        return ((JsonString) value).getString();
    }

    static URI optionalUri(JsonObject parent, String key) {
        var string = optionalString(parent, key);
        if (string == null) {
            return null;
        }
        try {
            return URI.create(string);
        } catch (IllegalArgumentException e) {
            throw new JsonDecodingException("Expected URI at: " + key, e);
        }
    }

    static int requireInt(JsonObject parent, String key) {
        if (absent(parent, key)) {
            throw new JsonDecodingException("Missing integer: " + key);
        }
        return number(parent, key).intValueExact();
    }

    static long optionalLong(JsonObject parent, String key, long fallback) {
        if (absent(parent, key)) {
            return fallback;
        }
        return number(parent, key).longValueExact();
    }

    static MinorUnitAmount optionalAmount(JsonObject parent, String key) {
        return absent(parent, key) ? MinorUnitAmount.zero() : new MinorUnitAmount(optionalLong(parent, key, 0L));
    }

    static boolean optionalBoolean(JsonObject parent, String key, boolean fallback) {
        if (absent(parent, key)) {
            return fallback;
        }
        var value = parent.get(key);
        return switch (value.getValueType()) {
            case TRUE -> true;
            case FALSE -> false;
            default -> throw new JsonDecodingException("Expected boolean at: " + key);
        };
    }

    static JsonArrayBuilder writeStrings(List<String> values) {
        var builder = Json.createArrayBuilder();
        values.forEach(builder::add);
        return builder;
    }

    static JsonArrayBuilder writeObjects(List<JsonObject> values) {
        var builder = Json.createArrayBuilder();
        values.forEach(builder::add);
        return builder;
    }

    private static JsonNumber number(JsonObject parent, String key) {
        var value = parent.get(key);
        if (!(value instanceof JsonNumber number)) {
            throw new JsonDecodingException("Expected integer at: " + key);
        }
        try {
            number.longValueExact();
        } catch (ArithmeticException e) {
            throw new JsonDecodingException("Expected integer at: " + key, e);
        }
        return number;
    }
}
