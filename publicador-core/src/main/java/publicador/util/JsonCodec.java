package publicador.util;

import java.util.Map;

/**
 * Codec for the flat JSON objects stored in channel {@code credentials} and
 * {@code preferences} columns.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * supports one level of scalar members. Stores that already have Jackson on the classpath
 * can plug in their own implementation.
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
   * Parses a flat JSON object. String, number and boolean members are returned as their
   * textual form; {@code null} members are dropped. Returns an empty map for {@code null},
   * blank or {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not a flat JSON object
   */
  Map<String, String> parseObject(String json);
}
