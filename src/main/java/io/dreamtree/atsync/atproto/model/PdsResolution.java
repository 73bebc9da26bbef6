package io.dreamtree.atsync.atproto.model;

/**
 * Outcome of handle resolution. {@code DEFAULT} means resolution could not be completed and the
 * default network was substituted; callers that only need a URL can ignore the kind.
 */
public record PdsResolution(Kind kind, String url, String did) {
  public enum Kind {
    RESOLVED,
    DEFAULT
  }

  public static PdsResolution resolved(String url, String did) {
    return new PdsResolution(Kind.RESOLVED, url, did);
  }

  public static PdsResolution fallback(String url) {
    return new PdsResolution(Kind.DEFAULT, url, null);
  }

  public boolean isResolved() {
    return kind == Kind.RESOLVED;
  }
}
