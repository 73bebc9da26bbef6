package io.dreamtree.atsync.client;

/** A non-success XRPC response from a PDS, or a transport failure when {@code status} is 0. */
public class PdsRequestException extends RuntimeException {
  private final String method;
  private final int status;
  private final String error;

  public PdsRequestException(String method, int status, String error, String message, Throwable cause) {
    super(message, cause);
    this.method = method;
    this.status = status;
    this.error = error;
  }

  public String getMethod() {
    return method;
  }

  public int getStatus() {
    return status;
  }

  public String getError() {
    return error;
  }
}
