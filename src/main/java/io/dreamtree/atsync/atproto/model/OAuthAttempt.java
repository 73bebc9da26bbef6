package io.dreamtree.atsync.atproto.model;

public record OAuthAttempt(
    String stateToken,
    String userId,
    String handle,
    String pdsUrl,
    String codeVerifier,
    long createdAt,
    long expiresAt) {

  public boolean isExpired(long nowMillis) {
    return expiresAt < nowMillis;
  }

  @Override
  public String toString() {
    return "OAuthAttempt[userId=" + userId + ", handle=" + handle + ", pdsUrl=" + pdsUrl
        + ", expiresAt=" + expiresAt + "]";
  }
}
