package liveevents.util;

import java.util.Map;

/**
 * Codec between plain Java values and JSON text.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a small, zero-dependency
 * encoder/decoder covering maps, lists, strings, numbers, booleans and {@code null}.
 * Users who already have Jackson, Gson, or another JSON library on the classpath
 * can implement this interface and pass it to {@link liveevents.EventSerializer}.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON text.
     *
     * @param value a map, iterable, array, string, number, boolean, enum, temporal or {@code null}
     * @return JSON text (never {@code null})
     * @throws IllegalArgumentException if the value, or anything nested in it, has no JSON form
     */
    String toJson(Object value);

    /**
     * Parses JSON text into maps ({@code LinkedHashMap}), lists, strings, numbers,
     * booleans and {@code null}.
     *
     * @param json the JSON text
     * @return the parsed value
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    Object parse(String json);

    /**
     * Parses JSON text that must hold an object.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    @SuppressWarnings("unchecked")
    default Map<String, Object> parseObject(String json) {
        Object value = parse(json);
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected JSON object");
        }
        return (Map<String, Object>) value;
    }
}
