package publicador.gateway.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import publicador.gateway.GatewayException;
import publicador.gateway.MediaRef;
import publicador.gateway.PostRequest;
import publicador.gateway.PostingGateway;
import publicador.gateway.PreviewResult;
import publicador.gateway.PublishReceipt;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Posting gateway client: {@code POST {serviceUrl}/post} and {@code POST {serviceUrl}/preview}
 * with JSON bodies.
 *
 * <p>Responses are classified into {@link GatewayException.Kind}s: 4xx and 2xx bodies that
 * report {@code success:false} or cannot be read are terminal, 5xx and transport failures are
 * retryable, and a call that outlives its timeout is abandoned as a timeout. This client
 * never retries by itself.
 *
 * <p>Successful receipts are cached by idempotency key, so a post repeated within the
 * cache TTL is answered locally.
 *
 * <p>This class is thread-safe.
 */
public final class HttpPostingGateway implements PostingGateway {
  private static final Logger logger = Logger.getLogger(HttpPostingGateway.class.getName());

  private static final String JSON = "application/json";

  private final String serviceUrl;
  private final String apiToken;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final IdempotencyCache idempotencyCache;
  private final Clock clock;

  private HttpPostingGateway(Builder builder) {
    String url = Objects.requireNonNull(builder.serviceUrl, "serviceUrl");
    if (url.isBlank()) {
      throw new IllegalArgumentException("serviceUrl must not be blank");
    }
    this.serviceUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.apiToken = builder.apiToken;
    this.httpClient = builder.httpClient != null ? builder.httpClient
        : HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    this.clock = builder.clock;
    this.idempotencyCache = new IdempotencyCache(builder.idempotencyTtl, builder.clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public PublishReceipt send(PostRequest request, long timeoutMs) throws GatewayException, InterruptedException {
    Objects.requireNonNull(request, "request");
    PublishReceipt cached = idempotencyCache.get(request.idempotencyKey());
    if (cached != null) {
      logger.fine("Returning cached receipt for " + request.idempotencyKey());
      return cached;
    }

    JsonNode response = call("/post", request, timeoutMs);
    if (!response.path("success").asBoolean(false)) {
      throw new GatewayException(GatewayException.Kind.TERMINAL, 200, errorMessage(response, "Post rejected"));
    }
    JsonNode data = response.path("data");
    PublishReceipt receipt = new PublishReceipt(textOrNull(data, "url"), publishedAt(data));
    idempotencyCache.put(request.idempotencyKey(), receipt);
    return receipt;
  }

  @Override
  public PreviewResult preview(PostRequest request, long timeoutMs) throws GatewayException, InterruptedException {
    Objects.requireNonNull(request, "request");
    JsonNode response = call("/preview", request, timeoutMs);
    if (!response.path("success").asBoolean(false)) {
      return new PreviewResult(false, errorMessage(response, "Preview rejected"));
    }
    JsonNode data = response.path("data");
    boolean valid = data.path("valid").asBoolean(true);
    return new PreviewResult(valid, valid ? null : previewErrors(data));
  }

  private JsonNode call(String path, PostRequest request, long timeoutMs)
      throws GatewayException, InterruptedException {
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0");
    }
    HttpRequest.Builder http = HttpRequest.newBuilder(URI.create(serviceUrl + path))
        .timeout(Duration.ofMillis(timeoutMs))
        .header("Content-Type", JSON)
        .header("Accept", JSON)
        .POST(HttpRequest.BodyPublishers.ofString(toJson(request)));
    if (apiToken != null && !apiToken.isBlank()) {
      http.header("Authorization", "Bearer " + apiToken);
    }

    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(http.build(), HttpResponse.BodyHandlers.ofString());
    HttpResponse<String> response;
    try {
      response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new GatewayException(GatewayException.Kind.TIMEOUT, 0,
          "No response from posting service within " + timeoutMs + "ms", e);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof HttpTimeoutException) {
        throw new GatewayException(GatewayException.Kind.TIMEOUT, 0,
            "No response from posting service within " + timeoutMs + "ms", cause);
      }
      throw new GatewayException(GatewayException.Kind.RETRYABLE, 0,
          "Posting service unreachable: " + describe(cause), cause);
    }
    return classify(response);
  }

  private JsonNode classify(HttpResponse<String> response) throws GatewayException {
    int status = response.statusCode();
    JsonNode body = parse(response.body());
    if (status >= 200 && status < 300) {
      if (body == null || !body.isObject()) {
        throw new GatewayException(GatewayException.Kind.TERMINAL, status,
            "Unreadable response from posting service");
      }
      return body;
    }
    String message = errorMessage(body, "HTTP " + status);
    GatewayException.Kind kind = status >= 500 ? GatewayException.Kind.RETRYABLE : GatewayException.Kind.TERMINAL;
    logger.warning("Posting service answered " + status + ": " + message);
    throw new GatewayException(kind, status, message);
  }

  String toJson(PostRequest request) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("platform", request.platform());
    root.put("channelIdentifier", request.channelIdentifier());
    root.putObject("credentials").put("apiKey", request.apiKey());
    putIfPresent(root, "body", request.body());
    putIfPresent(root, "bodyFormat", request.bodyFormat());
    putIfPresent(root, "idempotencyKey", request.idempotencyKey());
    putIfPresent(root, "language", request.language());
    putIfPresent(root, "title", request.title());
    putIfPresent(root, "description", request.description());
    putIfPresent(root, "tags", request.tags());
    if (!request.media().isEmpty()) {
      ArrayNode media = root.putArray("media");
      for (MediaRef ref : request.media()) {
        media.addObject()
            .put("src", ref.src())
            .put("type", ref.type())
            .put("hasSpoiler", ref.hasSpoiler());
      }
    }
    try {
      return objectMapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode request", e);
    }
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private Instant publishedAt(JsonNode data) {
    String raw = textOrNull(data, "publishedAt");
    if (raw == null) {
      return clock.instant();
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException e) {
      logger.warning("Unparseable publishedAt '" + raw + "'; using current time");
      return clock.instant();
    }
  }

  private static String previewErrors(JsonNode data) {
    JsonNode errors = data.path("errors");
    if (!errors.isArray() || errors.isEmpty()) {
      return null;
    }
    List<String> messages = new ArrayList<>();
    errors.forEach(e -> messages.add(e.asText()));
    return String.join(", ", messages);
  }

  private static String errorMessage(JsonNode body, String fallback) {
    if (body == null) {
      return fallback;
    }
    String message = textOrNull(body.path("error"), "message");
    return message != null ? message : fallback;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isValueNode() && !value.isNull() ? value.asText() : null;
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }

  /** Builder for {@link HttpPostingGateway}. */
  public static final class Builder {
    private String serviceUrl;
    private String apiToken;
    private Duration idempotencyTtl = Duration.ofMinutes(10);
    private HttpClient httpClient;
    private ObjectMapper objectMapper;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /** Base URL of the posting service, without the {@code /post} suffix. Required. */
    public Builder serviceUrl(String serviceUrl) {
      this.serviceUrl = serviceUrl;
      return this;
    }

    /** Sent as {@code Authorization: Bearer <token>} when set. */
    public Builder apiToken(String apiToken) {
      this.apiToken = apiToken;
      return this;
    }

    /** How long a successful receipt is reused for the same idempotency key. Zero disables. */
    public Builder idempotencyTtl(Duration idempotencyTtl) {
      this.idempotencyTtl = Objects.requireNonNull(idempotencyTtl, "idempotencyTtl");
      return this;
    }

    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public HttpPostingGateway build() {
      return new HttpPostingGateway(this);
    }
  }
}
