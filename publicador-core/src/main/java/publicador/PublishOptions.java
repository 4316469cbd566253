package publicador;

/**
 * Options for {@link PublicationEngine#publish}.
 *
 * @param force send every post again, including posts that are already PUBLISHED
 */
public record PublishOptions(boolean force) {
  public static final PublishOptions DEFAULT = new PublishOptions(false);

  public static PublishOptions forced() {
    return new PublishOptions(true);
  }
}
