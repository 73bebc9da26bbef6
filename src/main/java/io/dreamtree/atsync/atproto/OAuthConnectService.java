package io.dreamtree.atsync.atproto;

import io.dreamtree.atsync.atproto.dto.AtprotoDtos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class OAuthConnectService {
  private static final Logger log = LoggerFactory.getLogger(OAuthConnectService.class);

  private final AtprotoProperties properties;
  private final PdsResolver resolver;
  private final PkceGenerator pkce;
  private final OAuthStateStore stateStore;
  private final AtprotoOAuthClient oauthClient;
  private final AtprotoMetrics metrics;

  public OAuthConnectService(
      AtprotoProperties properties,
      PdsResolver resolver,
      PkceGenerator pkce,
      OAuthStateStore stateStore,
      AtprotoOAuthClient oauthClient,
      AtprotoMetrics metrics) {
    this.properties = properties;
    this.resolver = resolver;
    this.pkce = pkce;
    this.stateStore = stateStore;
    this.oauthClient = oauthClient;
    this.metrics = metrics;
  }

  public AtprotoDtos.ConnectResponse initiate(String userId, String handle) {
    ensureEnabled();
    if (handle == null || handle.isBlank()) {
      throw new AtprotoException(AtprotoErrorCode.INVALID_INPUT, "handle is required", 400);
    }
    String normalized = AtprotoUtils.normalizeHandle(handle);
    if (!AtprotoUtils.isValidHandle(normalized)) {
      throw new AtprotoException(AtprotoErrorCode.INVALID_INPUT, "handle is not a valid domain", 400);
    }

    String pdsUrl;
    try {
      pdsUrl = resolver.resolve(normalized);
    } catch (Exception e) {
      metrics.upstreamUnavailable("resolver");
      throw new AtprotoException(
          AtprotoErrorCode.UPSTREAM_UNAVAILABLE, "could not resolve handle", 400, e);
    }
    if (pdsUrl == null || pdsUrl.isBlank()) {
      metrics.upstreamUnavailable("resolver");
      throw new AtprotoException(
          AtprotoErrorCode.UPSTREAM_UNAVAILABLE, "could not resolve handle", 400);
    }

    String verifier = pkce.generateVerifier();
    String challenge = pkce.deriveChallenge(verifier);
    String state = stateStore.create(userId, normalized, pdsUrl, verifier);
    String authUrl = oauthClient.buildAuthorizeUrl(pdsUrl, state, challenge);

    metrics.connectInitiated();
    log.info("atproto connect initiated userId={} handle={} pds={}", userId, normalized, pdsUrl);
    return new AtprotoDtos.ConnectResponse(authUrl, pdsUrl);
  }

  private void ensureEnabled() {
    if (!properties.isEnabled()) {
      throw new AtprotoException(
          AtprotoErrorCode.FEATURE_DISABLED, "atproto integration is disabled", 403);
    }
  }
}
