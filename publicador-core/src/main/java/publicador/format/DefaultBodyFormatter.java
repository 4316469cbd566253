package publicador.format;

import java.util.Map;

/**
 * Built-in body template: optional title, content, description and hashtags separated by
 * blank lines, followed by an optional footer.
 *
 * <p>Recognised channel preferences:
 * <ul>
 *   <li>{@code includeTitle} - {@code "true"} to render the title first (off by default)
 *   <li>{@code tagCase} - see {@link TagsFormatter.TagCase#fromPreference}
 *   <li>{@code footer} - text appended after a blank line
 * </ul>
 */
public final class DefaultBodyFormatter implements BodyFormatter {
  public static final String PREF_INCLUDE_TITLE = "includeTitle";
  public static final String PREF_TAG_CASE = "tagCase";
  public static final String PREF_FOOTER = "footer";

  private static final String SEPARATOR = "\n\n";

  @Override
  public String format(BodyContent content, Map<String, String> preferences) {
    StringBuilder body = new StringBuilder();
    if (Boolean.parseBoolean(preferences.get(PREF_INCLUDE_TITLE))) {
      append(body, content.title());
    }
    append(body, content.content());
    append(body, content.description());
    append(body, TagsFormatter.format(content.tags(),
        TagsFormatter.TagCase.fromPreference(preferences.get(PREF_TAG_CASE))));
    append(body, preferences.get(PREF_FOOTER));
    return body.toString();
  }

  private static void append(StringBuilder body, String block) {
    if (block == null || block.isBlank()) {
      return;
    }
    if (body.length() > 0) {
      body.append(SEPARATOR);
    }
    body.append(block.trim());
  }
}
