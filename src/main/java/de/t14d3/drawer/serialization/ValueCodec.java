package de.t14d3.drawer.serialization;

/**
 * Turns cached values into the text payload stored in the value column and back.
 *
 * Values are plain structured data: {@code null}, strings, numbers, booleans,
 * lists and string-keyed maps, nested to any depth.
 */
public interface ValueCodec {

    String encode(Object value);

    Object decode(String payload);

    /**
     * Convert a structured-model object into plain structured data.
     */
    Object fromModel(Object model);

    /**
     * Convert plain structured data into an instance of {@code type}.
     */
    <T> T toModel(Object value, Class<T> type);
}
