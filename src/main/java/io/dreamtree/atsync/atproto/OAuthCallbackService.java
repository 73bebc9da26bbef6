package io.dreamtree.atsync.atproto;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import io.dreamtree.atsync.atproto.model.Connection;
import io.dreamtree.atsync.atproto.model.OAuthAttempt;
import java.text.ParseException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Completes an authorization redirect. Steps run strictly in order: the state is consumed before
 * any token exchange and the connection is saved only after a subject has been read from the
 * issued access token. A failure after consumption leaves the state spent.
 */
@Service
public class OAuthCallbackService {
  private static final Logger log = LoggerFactory.getLogger(OAuthCallbackService.class);

  private final AtprotoProperties properties;
  private final OAuthStateStore stateStore;
  private final PdsResolver resolver;
  private final AtprotoOAuthClient oauthClient;
  private final SessionStore sessionStore;
  private final AtprotoMetrics metrics;

  public OAuthCallbackService(
      AtprotoProperties properties,
      OAuthStateStore stateStore,
      PdsResolver resolver,
      AtprotoOAuthClient oauthClient,
      SessionStore sessionStore,
      AtprotoMetrics metrics) {
    this.properties = properties;
    this.stateStore = stateStore;
    this.resolver = resolver;
    this.oauthClient = oauthClient;
    this.sessionStore = sessionStore;
    this.metrics = metrics;
  }

  public Connection complete(String code, String state, String error, String errorDescription) {
    try {
      Connection connection = doComplete(code, state, error, errorDescription);
      metrics.callbackSuccess();
      return connection;
    } catch (AtprotoException e) {
      metrics.callbackFailure(e.getCode());
      throw e;
    }
  }

  private Connection doComplete(String code, String state, String error, String errorDescription) {
    if (!properties.isEnabled()) {
      throw new AtprotoException(
          AtprotoErrorCode.FEATURE_DISABLED, "atproto integration is disabled", 403);
    }
    if (error != null && !error.isBlank()) {
      String description =
          errorDescription != null && !errorDescription.isBlank() ? errorDescription : error;
      log.info("atproto authorization denied error={}", error);
      throw new AtprotoException(
          AtprotoErrorCode.AUTHORIZATION_DENIED,
          "authorization denied",
          401,
          Map.of(AtprotoException.DETAIL_DESCRIPTION, description));
    }
    if (code == null || code.isBlank() || state == null || state.isBlank()) {
      throw new AtprotoException(AtprotoErrorCode.INVALID_INPUT, "missing code or state", 400);
    }

    OAuthAttempt attempt =
        stateStore
            .consume(state)
            .orElseThrow(
                () ->
                    new AtprotoException(
                        AtprotoErrorCode.INVALID_OR_EXPIRED_STATE, "invalid or expired state", 400));

    String pdsUrl = attempt.pdsUrl();
    if (pdsUrl == null || pdsUrl.isBlank()) {
      pdsUrl = resolver.resolve(attempt.handle());
    }

    AtprotoOAuthClient.TokenSet tokens =
        oauthClient.exchangeCode(pdsUrl, code, attempt.codeVerifier());
    String did = extractSubject(tokens.accessToken());
    if (tokens.subject() != null && !tokens.subject().equals(did)) {
      throw new AtprotoException(
          AtprotoErrorCode.MALFORMED_TOKEN, "token response subject mismatch", 502);
    }

    Connection connection =
        new Connection(
            attempt.userId(),
            did,
            attempt.handle(),
            pdsUrl,
            tokens.accessToken(),
            tokens.refreshToken(),
            Instant.now().toEpochMilli());
    sessionStore.save(attempt.userId(), connection);
    log.info(
        "atproto connected userId={} handle={} did={}", attempt.userId(), attempt.handle(), did);
    return connection;
  }

  /** Reads {@code sub} from the access token without verifying it; the PDS is the verifier. */
  static String extractSubject(String accessToken) {
    JWTClaimsSet claims;
    try {
      claims = JWTParser.parse(accessToken).getJWTClaimsSet();
    } catch (ParseException e) {
      throw new AtprotoException(
          AtprotoErrorCode.MALFORMED_TOKEN, "access token is not a jwt", 502, e);
    }
    String subject = claims == null ? null : claims.getSubject();
    if (subject == null || !subject.startsWith("did:")) {
      throw new AtprotoException(
          AtprotoErrorCode.MALFORMED_TOKEN, "access token has no did subject", 502);
    }
    return subject;
  }
}
