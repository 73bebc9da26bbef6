package io.dreamtree.atsync.atproto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.nimbusds.jwt.JWTClaimsSet;
import io.dreamtree.atsync.support.AtprotoTestSupport;
import java.time.Instant;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AppSessionVerifierTest {
  private AtprotoProperties properties;
  private AppSessionVerifier verifier;

  @BeforeEach
  void setUp() {
    properties = AtprotoTestSupport.properties();
    verifier = new AppSessionVerifier(properties);
  }

  @Test
  void bearerTokenSubjectIsTheUserId() {
    String token = AtprotoTestSupport.appAccessToken(properties, "user-1", 300);
    assertEquals("user-1", verifier.requireUserId("Bearer " + token));
    assertEquals("user-1", verifier.requireUserId("bearer  " + token + " "));
  }

  @Test
  void missingOrMalformedHeaderIsUnauthorized() {
    assertUnauthorized(null);
    assertUnauthorized("");
    assertUnauthorized("Basic dXNlcjpwYXNz");
    assertUnauthorized("Bearer ");
    assertUnauthorized("Bearer not.a.jwt");
  }

  @Test
  void expiredTokenIsUnauthorized() {
    JWTClaimsSet claims =
        baseClaims().expirationTime(Date.from(Instant.now().minusSeconds(5))).build();
    assertUnauthorized("Bearer " + AtprotoTestSupport.sign(claims, properties.getAppJwt().getSecret()));
  }

  @Test
  void wrongAudienceIssuerOrTypeIsUnauthorized() {
    String secret = properties.getAppJwt().getSecret();
    assertUnauthorized("Bearer " + AtprotoTestSupport.sign(baseClaims().audience("other-app").build(), secret));
    assertUnauthorized("Bearer " + AtprotoTestSupport.sign(baseClaims().issuer("someone-else").build(), secret));
    assertUnauthorized(
        "Bearer " + AtprotoTestSupport.sign(baseClaims().claim("tokenType", "refresh").build(), secret));
  }

  @Test
  void tokenSignedWithAnotherSecretIsUnauthorized() {
    assertUnauthorized(
        "Bearer "
            + AtprotoTestSupport.sign(baseClaims().build(), "another-secret-that-is-also-32-bytes-long"));
  }

  @Test
  void shortSecretIsRejectedAtStartup() {
    AtprotoProperties weak = AtprotoTestSupport.properties();
    weak.getAppJwt().setSecret("too-short");
    assertThrows(IllegalStateException.class, () -> new AppSessionVerifier(weak));
  }

  private JWTClaimsSet.Builder baseClaims() {
    return new JWTClaimsSet.Builder()
        .issuer(properties.getAppJwt().getIssuer())
        .audience(properties.getAppJwt().getAudience())
        .subject("user-1")
        .expirationTime(Date.from(Instant.now().plusSeconds(300)))
        .claim("tokenType", "access");
  }

  private void assertUnauthorized(String header) {
    AtprotoException e = assertThrows(AtprotoException.class, () -> verifier.requireUserId(header));
    assertEquals(AtprotoErrorCode.UNAUTHORIZED, e.getCode());
    assertEquals(401, e.getHttpStatus());
  }
}
