package publicador.channel;

import publicador.gateway.GatewayException;
import publicador.gateway.PostRequest;
import publicador.gateway.PostingGateway;
import publicador.gateway.PreviewResult;
import publicador.model.Channel;
import publicador.spi.ConnectionProvider;
import publicador.spi.PublicationStore;
import publicador.util.StoreCalls;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Checks a channel end to end: local validation, then the gateway's non-mutating preview
 * verb. Nothing is written to storage and the preview call is never retried, so repeated
 * tests of an unchanged channel give the same answer.
 */
public final class ChannelTester {
  private static final Logger logger = Logger.getLogger(ChannelTester.class.getName());

  static final String PREVIEW_BODY = "Test connection message from Publicador";

  private final ConnectionProvider connectionProvider;
  private final PublicationStore store;
  private final ChannelValidator validator;
  private final PostingGateway gateway;
  private final long requestTimeoutMs;

  public ChannelTester(ConnectionProvider connectionProvider, PublicationStore store,
      ChannelValidator validator, PostingGateway gateway, long requestTimeoutMs) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    if (requestTimeoutMs <= 0) {
      throw new IllegalArgumentException("requestTimeoutMs must be > 0");
    }
    this.requestTimeoutMs = requestTimeoutMs;
  }

  /**
   * Tests the channel's connection and credentials.
   *
   * @throws ChannelValidationException if the channel does not exist
   */
  public ChannelTestResult testChannel(String channelId) {
    Objects.requireNonNull(channelId, "channelId");
    Channel channel = StoreCalls.withConnection(connectionProvider, "load channel " + channelId,
        conn -> store.findChannel(conn, channelId))
        .orElseThrow(() -> new ChannelValidationException("Channel not found"));

    ValidationResult validation = validator.validate(channel);
    if (!validation.isValid()) {
      logger.info("Channel " + channelId + " failed validation: " + validation.message());
      return ChannelTestResult.failed("Validation failed: " + validation.message());
    }

    PlatformParams params = PlatformParams.resolve(channel);
    PostRequest request = PostRequest.preview(channel.socialMedia().platformName(),
        params.targetChannelId(), params.apiKey(), PREVIEW_BODY);
    try {
      PreviewResult preview = gateway.preview(request, requestTimeoutMs);
      if (preview.valid()) {
        return ChannelTestResult.ok("Connection and credentials are valid (Preview mode)");
      }
      return new ChannelTestResult(false, "Platform rejected the preview request", preview.message());
    } catch (GatewayException e) {
      logger.warning("Preview failed for channel " + channelId + ": " + e.getMessage());
      return ChannelTestResult.failed(e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ChannelTestResult.failed("Channel test interrupted");
    }
  }
}
