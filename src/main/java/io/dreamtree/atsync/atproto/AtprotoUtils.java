package io.dreamtree.atsync.atproto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import java.util.regex.Pattern;

public final class AtprotoUtils {
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Pattern HANDLE =
      Pattern.compile("^([a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?\\.)+[a-z]([a-z0-9-]{0,61}[a-z0-9])?$");
  private static final int MAX_HANDLE_LENGTH = 253;

  // base32-sortable, as used by AT Protocol TIDs
  private static final String RECORD_KEY_ALPHABET = "234567abcdefghijklmnopqrstuvwxyz";
  private static final int RECORD_KEY_LENGTH = 13;

  private AtprotoUtils() {}

  public static String randomBase64Url(int bytesLength) {
    byte[] bytes = new byte[Math.max(16, bytesLength)];
    RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  public static String sha256Base64Url(String value) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(sha256(value));
  }

  /** Trims, drops a leading {@code @} and lowercases. Never returns null. */
  public static String normalizeHandle(String handle) {
    if (handle == null) return "";
    String h = handle.trim();
    if (h.startsWith("@")) h = h.substring(1);
    return h.toLowerCase(Locale.ROOT);
  }

  public static boolean isValidHandle(String normalizedHandle) {
    if (normalizedHandle == null || normalizedHandle.isEmpty()) return false;
    if (normalizedHandle.length() > MAX_HANDLE_LENGTH) return false;
    return HANDLE.matcher(normalizedHandle).matches();
  }

  /**
   * Deterministic record key for a local record id, so repeated syncs address the same PDS record.
   * Shaped like a TID: 13 characters, first one limited to the lower half of the alphabet.
   */
  public static String recordKeyFor(String localId) {
    if (localId == null || localId.isBlank()) {
      throw new IllegalArgumentException("record id required");
    }
    byte[] digest = sha256(localId);
    StringBuilder sb = new StringBuilder(RECORD_KEY_LENGTH);
    sb.append(RECORD_KEY_ALPHABET.charAt((digest[0] & 0xFF) % 16));
    for (int i = 1; i < RECORD_KEY_LENGTH; i++) {
      sb.append(RECORD_KEY_ALPHABET.charAt(digest[i] & 0x1F));
    }
    return sb.toString();
  }

  public static String trimTrailingSlash(String url) {
    if (url == null) return "";
    String trimmed = url.trim();
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed;
  }

  private static byte[] sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("sha256 error", e);
    }
  }
}
