package publicador.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a free-form tag string ({@code "news, Big Update #release"}) into space-separated
 * hashtags, optionally re-cased.
 */
public final class TagsFormatter {

  public enum TagCase {
    NONE("none"),
    CAMEL_CASE("camelCase"),
    PASCAL_CASE("pascalCase"),
    SNAKE_CASE("snake_case"),
    KEBAB_CASE("kebab-case"),
    LOWERCASE("lowercase"),
    UPPERCASE("uppercase");

    private final String preferenceValue;

    TagCase(String preferenceValue) {
      this.preferenceValue = preferenceValue;
    }

    /**
     * Maps a {@code tagCase} preference value; unknown or missing values map to {@link #NONE}.
     */
    public static TagCase fromPreference(String value) {
      if (value == null) {
        return NONE;
      }
      for (TagCase tagCase : values()) {
        if (tagCase.preferenceValue.equals(value)) {
          return tagCase;
        }
      }
      return NONE;
    }
  }

  public static String format(String tags) {
    return format(tags, TagCase.NONE);
  }

  /**
   * Splits on whitespace and commas, drops a leading {@code #} from each tag and re-adds it
   * after applying {@code tagCase}.
   *
   * @return the hashtags joined by single spaces, or an empty string when there are none
   */
  public static String format(String tags, TagCase tagCase) {
    if (tags == null || tags.isBlank()) {
      return "";
    }
    return Arrays.stream(tags.trim().split("[\\s,]+"))
        .filter(tag -> !tag.isEmpty())
        .map(tag -> tag.startsWith("#") ? tag.substring(1) : tag)
        .filter(tag -> !tag.isEmpty())
        .map(tag -> "#" + applyCase(tag, tagCase))
        .collect(Collectors.joining(" "));
  }

  private static String applyCase(String tag, TagCase tagCase) {
    switch (tagCase) {
      case LOWERCASE:
        return tag.toLowerCase(Locale.ROOT);
      case UPPERCASE:
        return tag.toUpperCase(Locale.ROOT);
      case NONE:
        return tag;
      default:
        break;
    }
    List<String> words = words(tag);
    if (words.isEmpty()) {
      return tag;
    }
    switch (tagCase) {
      case CAMEL_CASE: {
        StringBuilder sb = new StringBuilder(words.get(0));
        words.subList(1, words.size()).forEach(w -> sb.append(capitalize(w)));
        return sb.toString();
      }
      case PASCAL_CASE:
        return words.stream().map(TagsFormatter::capitalize).collect(Collectors.joining());
      case SNAKE_CASE:
        return String.join("_", words);
      case KEBAB_CASE:
        return String.join("-", words);
      default:
        return tag;
    }
  }

  // Lower-cased words split on camelCase humps, '-' and '_'.
  private static List<String> words(String tag) {
    String spaced = tag.replaceAll("(\\p{Ll})(\\p{Lu})", "$1 $2").replace('-', ' ').replace('_', ' ');
    List<String> words = new ArrayList<>();
    for (String word : spaced.toLowerCase(Locale.ROOT).split("\\s+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }

  private static String capitalize(String word) {
    return Character.toUpperCase(word.charAt(0)) + word.substring(1);
  }

  private TagsFormatter() {}
}
