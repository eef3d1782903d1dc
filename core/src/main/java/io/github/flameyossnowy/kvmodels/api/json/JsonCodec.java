package io.github.flameyossnowy.kvmodels.api.json;

/**
 * Converts values to and from the UTF-8 JSON text stored in the key-value store.
 */
public interface JsonCodec {

    String serialize(Object value);

    <T> T deserialize(String json, Class<T> targetType);
}
