package dualstore.util;

import java.util.Map;

/**
 * Codec for sync queue payloads: flat {@code Map<String, String>} objects to and from JSON.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * supports flat string-to-string objects, which is all a queue payload ever holds. Numbers
 * and booleans travel as strings. A {@code null} value is kept both ways so a payload can
 * express "clear this column".
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a payload as a JSON object. An empty or {@code null} map encodes as {@code "{}"}.
   *
   * @param payload the payload to encode
   * @return JSON object string, never {@code null}
   * @throws IllegalArgumentException if the map contains a {@code null} key
   */
  String toJson(Map<String, String> payload);

  /**
   * Parses a JSON object into a payload map. Returns an empty map for {@code null}, empty, or
   * {@code "null"} input. JSON {@code null} values map to {@code null} entries.
   *
   * @param json the JSON string to parse
   * @return parsed map in document order (never {@code null})
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);
}
