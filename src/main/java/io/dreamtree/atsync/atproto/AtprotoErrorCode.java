package io.dreamtree.atsync.atproto;

/** Error codes surfaced in JSON bodies and, for the OAuth callback, as the {@code atp_error} reason. */
public enum AtprotoErrorCode {
  INVALID_INPUT("missing_params"),
  INVALID_OR_EXPIRED_STATE("invalid_state"),
  AUTHORIZATION_DENIED("authorization_denied"),
  TOKEN_EXCHANGE_FAILED("token_exchange_failed"),
  MALFORMED_TOKEN("malformed_token"),
  NOT_CONNECTED("not_connected"),
  UPSTREAM_UNAVAILABLE("upstream_unavailable"),
  UNAUTHORIZED("unauthorized"),
  FEATURE_DISABLED("disabled");

  private final String redirectReason;

  AtprotoErrorCode(String redirectReason) {
    this.redirectReason = redirectReason;
  }

  public String redirectReason() {
    return redirectReason;
  }
}
