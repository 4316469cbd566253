package publicador.jdbc;

import publicador.model.Channel;
import publicador.model.MediaType;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.model.PublicationMedia;
import publicador.model.PublicationStatus;
import publicador.model.SocialMedia;
import publicador.model.StorageType;
import publicador.spi.PublicationStore;
import publicador.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link PublicationStore} over plain JDBC with SQL that runs on H2 and PostgreSQL.
 *
 * <p>Statuses are stored as enum names. The lock is a single conditional UPDATE
 * ({@code ... WHERE id=? AND status<>'PROCESSING'}); no row is read first. Channel
 * {@code credentials} and {@code preferences} are flat JSON objects decoded with a
 * {@link JsonCodec}; credentials that cannot be decoded surface as {@code null} so the
 * channel validator can report them.
 *
 * <p>Table names default to {@code publications}, {@code posts}, {@code channels},
 * {@code projects} and {@code publication_media}; an optional prefix is prepended to each.
 * The expected layout ships as {@code publicador/jdbc/schema.sql} on the classpath.
 */
public class JdbcPublicationStore implements PublicationStore {
  private static final Logger logger = Logger.getLogger(JdbcPublicationStore.class.getName());

  private static final String TABLE_PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*|";
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String PUBLICATION_COLUMNS = "id, project_id, created_by, status, title, description, "
      + "content, tags, language, scheduled_at, processing_started_at";
  private static final String POST_COLUMNS = "id, publication_id, channel_id, status, content, tags, "
      + "scheduled_at, published_at, error_message, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<Post> POST_ROW_MAPPER = rs -> new Post(
      rs.getString("id"),
      rs.getString("publication_id"),
      rs.getString("channel_id"),
      PostStatus.valueOf(rs.getString("status")),
      rs.getString("content"),
      rs.getString("tags"),
      JdbcTemplate.instant(rs, "scheduled_at"),
      JdbcTemplate.instant(rs, "published_at"),
      rs.getString("error_message"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private static final JdbcTemplate.RowMapper<PublicationMedia> MEDIA_ROW_MAPPER = rs -> new PublicationMedia(
      rs.getString("media_id"),
      MediaType.valueOf(rs.getString("media_type")),
      StorageType.valueOf(rs.getString("storage_type")),
      rs.getString("storage_path"),
      rs.getInt("sort_order"),
      rs.getBoolean("has_spoiler"));

  private final String publications;
  private final String posts;
  private final String channels;
  private final String projects;
  private final String media;
  private final JsonCodec jsonCodec;

  public JdbcPublicationStore() {
    this("", JsonCodec.getDefault());
  }

  /**
   * @param tablePrefix prefix for every table name, e.g. {@code "pub_"}; may be empty
   * @param jsonCodec   codec for the channel credentials and preferences columns
   */
  public JdbcPublicationStore(String tablePrefix, JsonCodec jsonCodec) {
    Objects.requireNonNull(tablePrefix, "tablePrefix");
    if (!tablePrefix.matches(TABLE_PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + tablePrefix);
    }
    this.publications = tablePrefix + "publications";
    this.posts = tablePrefix + "posts";
    this.channels = tablePrefix + "channels";
    this.projects = tablePrefix + "projects";
    this.media = tablePrefix + "publication_media";
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public Optional<Publication> findPublication(Connection conn, String publicationId) {
    String sql = "SELECT " + PUBLICATION_COLUMNS + " FROM " + publications + " WHERE id=?";
    List<PublicationMedia> attached = JdbcTemplate.query(conn,
        "SELECT media_id, media_type, storage_type, storage_path, sort_order, has_spoiler FROM " + media
            + " WHERE publication_id=? ORDER BY sort_order, media_id",
        MEDIA_ROW_MAPPER, publicationId);
    return JdbcTemplate.queryOne(conn, sql, rs -> mapPublication(rs, attached), publicationId);
  }

  @Override
  public List<Post> findPosts(Connection conn, String publicationId) {
    String sql = "SELECT " + POST_COLUMNS + " FROM " + posts
        + " WHERE publication_id=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, POST_ROW_MAPPER, publicationId);
  }

  @Override
  public Optional<Post> findPost(Connection conn, String postId) {
    String sql = "SELECT " + POST_COLUMNS + " FROM " + posts + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, POST_ROW_MAPPER, postId);
  }

  @Override
  public Optional<Channel> findChannel(Connection conn, String channelId) {
    String sql = "SELECT c.id, c.project_id, c.social_media, c.name, c.channel_identifier, c.language, "
        + "c.credentials, c.preferences, c.is_active, c.archived_at, p.archived_at AS project_archived_at "
        + "FROM " + channels + " c LEFT JOIN " + projects + " p ON p.id = c.project_id WHERE c.id=?";
    return JdbcTemplate.queryOne(conn, sql, this::mapChannel, channelId);
  }

  @Override
  public int markProcessing(Connection conn, String publicationId, Instant startedAt) {
    String sql = "UPDATE " + publications + " SET status=?, processing_started_at=?"
        + " WHERE id=? AND status<>?";
    return JdbcTemplate.update(conn, sql,
        PublicationStatus.PROCESSING, startedAt, publicationId, PublicationStatus.PROCESSING);
  }

  @Override
  public int markProcessingIfScheduled(Connection conn, String publicationId, Instant startedAt) {
    String sql = "UPDATE " + publications + " SET status=?, processing_started_at=?"
        + " WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql,
        PublicationStatus.PROCESSING, startedAt, publicationId, PublicationStatus.SCHEDULED);
  }

  @Override
  public int release(Connection conn, String publicationId, PublicationStatus finalStatus) {
    String sql = "UPDATE " + publications + " SET status=?, processing_started_at=NULL WHERE id=?";
    return JdbcTemplate.update(conn, sql, finalStatus, publicationId);
  }

  @Override
  public int markPostPublished(Connection conn, String postId, Instant publishedAt) {
    String sql = "UPDATE " + posts + " SET status=?, published_at=?, error_message=NULL WHERE id=?";
    return JdbcTemplate.update(conn, sql, PostStatus.PUBLISHED, publishedAt, postId);
  }

  @Override
  public int markPostFailed(Connection conn, String postId, String error) {
    String sql = "UPDATE " + posts + " SET status=?, error_message=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, PostStatus.FAILED, truncateError(error), postId);
  }

  @Override
  public List<Publication> findDueScheduled(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + PUBLICATION_COLUMNS + " FROM " + publications + " p"
        + " WHERE status=? AND (scheduled_at <= ?"
        + " OR EXISTS (SELECT 1 FROM " + posts + " s WHERE s.publication_id = p.id AND s.scheduled_at <= ?))"
        + " ORDER BY scheduled_at NULLS FIRST, id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> mapPublication(rs, List.of()),
        PublicationStatus.SCHEDULED, now, now, limit);
  }

  @Override
  public int markExpired(Connection conn, String publicationId) {
    String sql = "UPDATE " + publications + " SET status=? WHERE id=? AND status=?";
    return JdbcTemplate.update(conn, sql, PublicationStatus.EXPIRED, publicationId, PublicationStatus.SCHEDULED);
  }

  private static Publication mapPublication(ResultSet rs, List<PublicationMedia> attached) throws SQLException {
    return new Publication(
        rs.getString("id"),
        rs.getString("project_id"),
        rs.getString("created_by"),
        PublicationStatus.valueOf(rs.getString("status")),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("content"),
        rs.getString("tags"),
        rs.getString("language"),
        JdbcTemplate.instant(rs, "scheduled_at"),
        JdbcTemplate.instant(rs, "processing_started_at"),
        attached);
  }

  private Channel mapChannel(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    return new Channel(
        id,
        rs.getString("project_id"),
        SocialMedia.valueOf(rs.getString("social_media")),
        rs.getString("name"),
        rs.getString("channel_identifier"),
        rs.getString("language"),
        decodeCredentials(id, rs.getString("credentials")),
        decodePreferences(id, rs.getString("preferences")),
        rs.getBoolean("is_active"),
        JdbcTemplate.instant(rs, "archived_at"),
        rs.getTimestamp("project_archived_at") != null);
  }

  private Map<String, String> decodeCredentials(String channelId, String json) {
    try {
      return jsonCodec.parseObject(json);
    } catch (IllegalArgumentException e) {
      logger.warning("Unreadable credentials for channel " + channelId + ": " + e.getMessage());
      return null;
    }
  }

  private Map<String, String> decodePreferences(String channelId, String json) {
    try {
      return jsonCodec.parseObject(json);
    } catch (IllegalArgumentException e) {
      logger.warning("Ignoring unreadable preferences for channel " + channelId + ": " + e.getMessage());
      return Map.of();
    }
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
