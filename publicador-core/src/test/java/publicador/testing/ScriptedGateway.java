package publicador.testing;

import publicador.gateway.GatewayException;
import publicador.gateway.PostRequest;
import publicador.gateway.PostingGateway;
import publicador.gateway.PreviewResult;
import publicador.gateway.PublishReceipt;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Gateway whose responses are scripted per target channel identifier. Unscripted sends
 * succeed with {@code https://example.test/<target>}.
 */
public class ScriptedGateway implements PostingGateway {

  @FunctionalInterface
  public interface Response {
    PublishReceipt respond(PostRequest request) throws GatewayException, InterruptedException;
  }

  public static final Instant PUBLISHED_AT = Instant.parse("2026-03-01T12:00:00Z");

  public final List<PostRequest> sent = new CopyOnWriteArrayList<>();
  public final List<PostRequest> previews = new CopyOnWriteArrayList<>();
  private final Map<String, Deque<Response>> scripts = new ConcurrentHashMap<>();
  private volatile PreviewResult previewResult = new PreviewResult(true, null);

  /** Queues responses for the next calls targeting {@code target}; the last one repeats. */
  public ScriptedGateway script(String target, Response... responses) {
    scripts.put(target, new ArrayDeque<>(List.of(responses)));
    return this;
  }

  public ScriptedGateway previewResult(PreviewResult result) {
    this.previewResult = result;
    return this;
  }

  public static Response ok() {
    return request -> new PublishReceipt("https://example.test/" + request.channelIdentifier(), PUBLISHED_AT);
  }

  public static Response fail(GatewayException.Kind kind, String message) {
    return request -> {
      throw new GatewayException(kind, message);
    };
  }

  public static Response slow(long millis) {
    return request -> {
      Thread.sleep(millis);
      return new PublishReceipt(null, PUBLISHED_AT);
    };
  }

  public long sendsTo(String target) {
    return sent.stream().filter(r -> r.channelIdentifier().equals(target)).count();
  }

  @Override
  public PublishReceipt send(PostRequest request, long timeoutMs) throws GatewayException, InterruptedException {
    sent.add(request);
    Deque<Response> queue = scripts.get(request.channelIdentifier());
    Response response;
    if (queue == null) {
      response = ok();
    } else {
      synchronized (queue) {
        response = queue.size() > 1 ? queue.poll() : queue.peek();
      }
    }
    return response.respond(request);
  }

  @Override
  public PreviewResult preview(PostRequest request, long timeoutMs) throws GatewayException, InterruptedException {
    previews.add(request);
    return previewResult;
  }
}
