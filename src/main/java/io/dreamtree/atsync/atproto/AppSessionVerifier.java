package io.dreamtree.atsync.atproto;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling user from the app's own HS256 access token. The token subject is the user
 * id; nothing in a request body can override it.
 */
@Component
public class AppSessionVerifier {
  private final AtprotoProperties properties;
  private final byte[] secret;

  public AppSessionVerifier(AtprotoProperties properties) {
    this.properties = properties;
    byte[] secretBytes = properties.getAppJwt().getSecret().getBytes(StandardCharsets.UTF_8);
    if (secretBytes.length < 32) {
      throw new IllegalStateException("APP_JWT_SECRET must be at least 32 bytes");
    }
    this.secret = secretBytes;
  }

  public String requireUserId(String authorizationHeader) {
    String token = extractBearerToken(authorizationHeader);
    try {
      SignedJWT jwt = SignedJWT.parse(token);
      if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())
          || !jwt.verify(new MACVerifier(secret))) {
        throw unauthorized("invalid access token");
      }
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      AtprotoProperties.AppJwt cfg = properties.getAppJwt();
      if (claims.getIssuer() == null || !claims.getIssuer().equals(cfg.getIssuer())) {
        throw unauthorized("invalid access token");
      }
      if (claims.getAudience() == null || !claims.getAudience().contains(cfg.getAudience())) {
        throw unauthorized("invalid access token");
      }
      Date expires = claims.getExpirationTime();
      if (expires == null || expires.before(new Date())) {
        throw unauthorized("access token expired");
      }
      if (!"access".equals(claims.getClaim("tokenType"))) {
        throw unauthorized("invalid access token type");
      }
      String subject = claims.getSubject();
      if (subject == null || subject.isBlank()) {
        throw unauthorized("invalid access token");
      }
      return subject;
    } catch (AtprotoException e) {
      throw e;
    } catch (Exception e) {
      throw new AtprotoException(AtprotoErrorCode.UNAUTHORIZED, "invalid access token", 401, e);
    }
  }

  private static String extractBearerToken(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      throw unauthorized("missing authorization header");
    }
    String value = authorizationHeader.trim();
    if (!value.regionMatches(true, 0, "Bearer ", 0, 7)) {
      throw unauthorized("invalid authorization type");
    }
    String token = value.substring(7).trim();
    if (token.isBlank()) {
      throw unauthorized("missing access token");
    }
    return token;
  }

  private static AtprotoException unauthorized(String message) {
    return new AtprotoException(AtprotoErrorCode.UNAUTHORIZED, message, 401);
  }
}
