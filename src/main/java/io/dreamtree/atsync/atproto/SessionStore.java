package io.dreamtree.atsync.atproto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dreamtree.atsync.atproto.model.Connection;
import io.dreamtree.atsync.atproto.model.ConnectionStatus;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * At most one {@link Connection} per user, stored encrypted. Sync bookkeeping lives under a
 * separate key so the connection itself is only ever written by the callback flow.
 */
@Service
public class SessionStore {
  private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
  private static final String PREFIX_CONNECTION = "atproto:connection:";
  private static final String PREFIX_LAST_SYNC = "atproto:connection:lastsync:";
  private static final String PREFIX_SYNC_OFF = "atproto:connection:syncoff:";

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final SessionCipher cipher;

  public SessionStore(StringRedisTemplate redis, ObjectMapper objectMapper, SessionCipher cipher) {
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.cipher = cipher;
  }

  public void save(String userId, Connection connection) {
    if (connection == null || !userId.equals(connection.userId())) {
      throw new IllegalArgumentException("connection does not belong to user");
    }
    String json;
    try {
      json = objectMapper.writeValueAsString(connection);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("connection serialization error", e);
    }
    redis.opsForValue().set(connectionKey(userId), cipher.encrypt(json));
  }

  public Optional<Connection> get(String userId) {
    String raw = redis.opsForValue().get(connectionKey(userId));
    if (raw == null || raw.isBlank()) return Optional.empty();
    Connection connection;
    try {
      connection = objectMapper.readValue(cipher.decrypt(raw), Connection.class);
    } catch (IllegalStateException | JsonProcessingException e) {
      log.warn("ignoring unreadable connection for userId={}: {}", userId, e.getMessage());
      return Optional.empty();
    }
    if (!userId.equals(connection.userId())) {
      log.warn("ignoring connection stored under userId={} for another user", userId);
      return Optional.empty();
    }
    return Optional.of(connection);
  }

  public ConnectionStatus status(String userId) {
    return get(userId)
        .map(
            connection ->
                ConnectionStatus.of(connection, isSyncEnabled(userId), lastSyncAt(userId)))
        .orElseGet(ConnectionStatus::disconnected);
  }

  /**
   * Sync is on for a new connection. Turning it off only marks the connection; callers that sync
   * on the user's behalf check the flag, an explicit sync request does not.
   */
  public ConnectionStatus setSyncEnabled(String userId, boolean enabled) {
    if (get(userId).isEmpty()) return ConnectionStatus.disconnected();
    if (enabled) {
      redis.delete(PREFIX_SYNC_OFF + userId);
    } else {
      redis.opsForValue().set(PREFIX_SYNC_OFF + userId, "1");
    }
    return status(userId);
  }

  /** Local only: tokens are dropped without contacting the PDS. */
  public void delete(String userId) {
    redis.delete(
        List.of(connectionKey(userId), PREFIX_LAST_SYNC + userId, PREFIX_SYNC_OFF + userId));
  }

  public void markSynced(String userId, long syncedAt) {
    redis.opsForValue().set(PREFIX_LAST_SYNC + userId, Long.toString(syncedAt));
  }

  private boolean isSyncEnabled(String userId) {
    return redis.opsForValue().get(PREFIX_SYNC_OFF + userId) == null;
  }

  private Long lastSyncAt(String userId) {
    String raw = redis.opsForValue().get(PREFIX_LAST_SYNC + userId);
    if (raw == null || raw.isBlank()) return null;
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      log.warn("ignoring malformed last sync value for userId={}", userId);
      return null;
    }
  }

  private static String connectionKey(String userId) {
    return PREFIX_CONNECTION + userId;
  }
}
