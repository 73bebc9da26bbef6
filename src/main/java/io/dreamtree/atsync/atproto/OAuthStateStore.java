package io.dreamtree.atsync.atproto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dreamtree.atsync.atproto.model.OAuthAttempt;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Single-use OAuth attempts keyed by state token.
 *
 * <p>{@link #consume} relies on Redis {@code GETDEL}, so of any number of concurrent callbacks
 * carrying the same state at most one receives the attempt. Attempts that are never consumed
 * disappear with their key TTL.
 */
@Service
public class OAuthStateStore {
  private static final Logger log = LoggerFactory.getLogger(OAuthStateStore.class);
  private static final String PREFIX_OAUTH_STATE = "atproto:oauth:state:";
  private static final int STATE_TOKEN_BYTES = 32;

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final AtprotoProperties properties;

  public OAuthStateStore(
      StringRedisTemplate redis, ObjectMapper objectMapper, AtprotoProperties properties) {
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public String create(String userId, String handle, String pdsUrl, String codeVerifier) {
    String stateToken = AtprotoUtils.randomBase64Url(STATE_TOKEN_BYTES);
    long ttlSeconds = Math.max(1, properties.getStateTtlSeconds());
    long now = now();
    OAuthAttempt attempt =
        new OAuthAttempt(
            stateToken, userId, handle, pdsUrl, codeVerifier, now, now + ttlSeconds * 1000);
    String raw;
    try {
      raw = objectMapper.writeValueAsString(attempt);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("oauth attempt serialization error", e);
    }
    redis.opsForValue().set(PREFIX_OAUTH_STATE + stateToken, raw, Duration.ofSeconds(ttlSeconds));
    return stateToken;
  }

  public Optional<OAuthAttempt> consume(String stateToken) {
    if (stateToken == null || stateToken.isBlank()) return Optional.empty();
    String raw = redis.opsForValue().getAndDelete(PREFIX_OAUTH_STATE + stateToken);
    if (raw == null || raw.isBlank()) return Optional.empty();

    OAuthAttempt attempt;
    try {
      attempt = objectMapper.readValue(raw, OAuthAttempt.class);
    } catch (JsonProcessingException e) {
      log.warn("discarding unreadable oauth attempt: {}", e.getOriginalMessage());
      return Optional.empty();
    }
    if (attempt.isExpired(now())) {
      log.info("oauth attempt expired userId={} handle={}", attempt.userId(), attempt.handle());
      return Optional.empty();
    }
    return Optional.of(attempt);
  }

  private long now() {
    return Instant.now().toEpochMilli();
  }
}
