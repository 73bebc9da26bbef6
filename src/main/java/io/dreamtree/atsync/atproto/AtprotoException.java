package io.dreamtree.atsync.atproto;

import java.util.Map;

public class AtprotoException extends RuntimeException {
  public static final String DETAIL_DESCRIPTION = "description";

  private final AtprotoErrorCode code;
  private final int httpStatus;
  private final Map<String, Object> details;

  public AtprotoException(AtprotoErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, Map.of(), null);
  }

  public AtprotoException(AtprotoErrorCode code, String message, int httpStatus, Throwable cause) {
    this(code, message, httpStatus, Map.of(), cause);
  }

  public AtprotoException(
      AtprotoErrorCode code, String message, int httpStatus, Map<String, Object> details) {
    this(code, message, httpStatus, details, null);
  }

  public AtprotoException(
      AtprotoErrorCode code,
      String message,
      int httpStatus,
      Map<String, Object> details,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
    this.details = details == null ? Map.of() : details;
  }

  public AtprotoErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  /**
   * Reason placed in the {@code atp_error} query parameter. A provider denial carries the
   * provider's own description so the profile page can show it.
   */
  public String redirectReason() {
    Object description = details.get(DETAIL_DESCRIPTION);
    if (code == AtprotoErrorCode.AUTHORIZATION_DENIED && description != null) {
      return description.toString();
    }
    return code.redirectReason();
  }
}
