package io.dreamtree.atsync.atproto.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionStatus(
    boolean connected,
    String did,
    String handle,
    String pdsUrl,
    boolean syncEnabled,
    Long connectedAt,
    Long lastSyncAt) {

  public static ConnectionStatus disconnected() {
    return new ConnectionStatus(false, null, null, null, false, null, null);
  }

  public static ConnectionStatus of(Connection connection, boolean syncEnabled, Long lastSyncAt) {
    return new ConnectionStatus(
        true,
        connection.did(),
        connection.handle(),
        connection.pdsUrl(),
        syncEnabled,
        connection.connectedAt(),
        lastSyncAt);
  }
}
