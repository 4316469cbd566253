package publicador.gateway;

/**
 * Outbound posting service.
 *
 * <p>Each call issues exactly one request. Implementations do not retry; the dispatcher owns
 * the retry loop so that attempts are counted per post. Implementations must honour
 * {@code timeoutMs} by abandoning the in-flight request and throwing a
 * {@link GatewayException.Kind#TIMEOUT} failure.
 *
 * @see publicador.gateway.http.HttpPostingGateway
 */
public interface PostingGateway {

  /**
   * Publishes one post.
   *
   * @param request   payload to send
   * @param timeoutMs per-call timeout in milliseconds
   * @return receipt for the published post
   * @throws GatewayException     if the service rejected the request or could not be reached
   * @throws InterruptedException if the calling thread was interrupted while waiting
   */
  PublishReceipt send(PostRequest request, long timeoutMs) throws GatewayException, InterruptedException;

  /**
   * Validates a channel's connection and credentials without publishing.
   */
  PreviewResult preview(PostRequest request, long timeoutMs) throws GatewayException, InterruptedException;
}
