package publicador.channel;

import java.util.List;

/**
 * Outcome of {@link ChannelValidator#validate}: valid, or the list of reasons in check order.
 */
public record ValidationResult(List<String> errors) {
  private static final ValidationResult VALID = new ValidationResult(List.of());

  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public static ValidationResult invalid(List<String> errors) {
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("invalid result needs at least one reason");
    }
    return new ValidationResult(errors);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  /**
   * @return the reasons joined by {@code ", "}, or an empty string when valid
   */
  public String message() {
    return String.join(", ", errors);
  }
}
