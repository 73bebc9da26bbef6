package io.dreamtree.atsync.atproto;

import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.DirectDecrypter;
import com.nimbusds.jose.crypto.DirectEncrypter;
import java.security.SecureRandom;
import java.text.ParseException;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Encrypts stored connections as compact JWE ({@code dir} + {@code A256GCM}). */
@Component
public class SessionCipher {
  private static final Logger log = LoggerFactory.getLogger(SessionCipher.class);
  private static final int KEY_BYTES = 32;

  private final byte[] key;

  public SessionCipher(AtprotoProperties properties) {
    this.key = loadOrGenerateKey(properties.getSessionEncryptionKey());
  }

  public String encrypt(String plaintext) {
    try {
      JWEObject jwe =
          new JWEObject(
              new JWEHeader(JWEAlgorithm.DIR, EncryptionMethod.A256GCM), new Payload(plaintext));
      jwe.encrypt(new DirectEncrypter(key));
      return jwe.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("session encryption failed", e);
    }
  }

  public String decrypt(String compact) {
    try {
      JWEObject jwe = JWEObject.parse(compact);
      jwe.decrypt(new DirectDecrypter(key));
      return jwe.getPayload().toString();
    } catch (ParseException | JOSEException e) {
      throw new IllegalStateException("session decryption failed", e);
    }
  }

  private static byte[] loadOrGenerateKey(String base64Key) {
    if (base64Key == null || base64Key.isBlank()) {
      log.warn(
          "app.atproto.session-encryption-key is not set; using an ephemeral key, stored connections will not survive a restart");
      byte[] generated = new byte[KEY_BYTES];
      new SecureRandom().nextBytes(generated);
      return generated;
    }
    byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(base64Key.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("app.atproto.session-encryption-key must be base64", e);
    }
    if (decoded.length != KEY_BYTES) {
      throw new IllegalStateException("app.atproto.session-encryption-key must decode to 32 bytes");
    }
    return decoded;
  }
}
