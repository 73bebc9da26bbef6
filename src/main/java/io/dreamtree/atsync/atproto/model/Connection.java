package io.dreamtree.atsync.atproto.model;

/** A user's link to their PDS. Tokens are opaque and must not leave the server. */
public record Connection(
    String userId,
    String did,
    String handle,
    String pdsUrl,
    String accessToken,
    String refreshToken,
    long connectedAt) {

  @Override
  public String toString() {
    return "Connection[userId=" + userId + ", did=" + did + ", handle=" + handle + ", pdsUrl="
        + pdsUrl + ", connectedAt=" + connectedAt + "]";
  }
}
