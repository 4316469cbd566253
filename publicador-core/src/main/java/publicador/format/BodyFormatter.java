package publicador.format;

import java.util.Map;

/**
 * Renders the channel-specific post body. Implementations must be pure functions.
 *
 * @see DefaultBodyFormatter
 */
@FunctionalInterface
public interface BodyFormatter {

  /**
   * @param content     the text fields to render
   * @param preferences the channel's preference map (never {@code null})
   * @return the rendered body; empty when there is nothing to render
   */
  String format(BodyContent content, Map<String, String> preferences);
}
