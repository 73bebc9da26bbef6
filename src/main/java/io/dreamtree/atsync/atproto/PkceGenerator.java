package io.dreamtree.atsync.atproto;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * PKCE (RFC 7636) verifier and S256 challenge generation.
 *
 * <p>Verifiers are 64 characters of base64url drawn from 48 random bytes, which keeps them inside
 * the unreserved alphabet and the 43-128 length window. The plain method is never offered.
 */
@Component
public class PkceGenerator {
  public static final String CHALLENGE_METHOD = "S256";

  private static final int VERIFIER_BYTES = 48;
  private static final Pattern VERIFIER = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

  public String generateVerifier() {
    return AtprotoUtils.randomBase64Url(VERIFIER_BYTES);
  }

  /** BASE64URL(SHA-256(verifier)) without padding. */
  public String deriveChallenge(String verifier) {
    if (verifier == null || !VERIFIER.matcher(verifier).matches()) {
      throw new IllegalArgumentException("invalid pkce code verifier");
    }
    return AtprotoUtils.sha256Base64Url(verifier);
  }
}
