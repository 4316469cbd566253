package publicador.gateway;

import java.time.Instant;
import java.util.Objects;

/**
 * Gateway acknowledgement of a published post. {@code url} may be {@code null}.
 */
public record PublishReceipt(String url, Instant publishedAt) {
  public PublishReceipt {
    Objects.requireNonNull(publishedAt, "publishedAt");
  }
}
