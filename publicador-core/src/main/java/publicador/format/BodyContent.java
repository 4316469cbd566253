package publicador.format;

/**
 * Text fields a post body is rendered from, with per-post overrides already applied.
 */
public record BodyContent(String title, String content, String description, String tags, String language) {
}
