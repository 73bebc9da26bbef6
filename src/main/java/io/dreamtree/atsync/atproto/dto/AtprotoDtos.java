package io.dreamtree.atsync.atproto.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public final class AtprotoDtos {
  private AtprotoDtos() {}

  public record ConnectRequest(@NotBlank String handle) {}

  public record ConnectResponse(String authUrl, String pdsUrl) {}

  public record DisconnectResponse(boolean success) {}

  public record SyncSettingsRequest(@NotNull Boolean enabled) {}

  /** Published at the client id URL; authorization servers fetch it to learn about this client. */
  public record ClientMetadata(
      @JsonProperty("client_id") String clientId,
      @JsonProperty("client_name") String clientName,
      @JsonProperty("client_uri") String clientUri,
      @JsonProperty("logo_uri") String logoUri,
      @JsonProperty("tos_uri") String tosUri,
      @JsonProperty("policy_uri") String policyUri,
      @JsonProperty("redirect_uris") List<String> redirectUris,
      @JsonProperty("grant_types") List<String> grantTypes,
      @JsonProperty("response_types") List<String> responseTypes,
      String scope,
      @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
      @JsonProperty("dpop_bound_access_tokens") boolean dpopBoundAccessTokens,
      @JsonProperty("application_type") String applicationType) {}
}
