package publicador.gateway;

/**
 * Gateway answer to a preview request. {@code message} carries the platform's reason when
 * {@code valid} is {@code false}.
 */
public record PreviewResult(boolean valid, String message) {
}
