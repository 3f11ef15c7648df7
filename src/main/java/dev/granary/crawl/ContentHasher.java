package dev.granary.crawl;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hashes for announcements. The hash of the normalized detail link is the announcement's
 * {@code externalId} within its source; the hash of the analysis text (detail text plus parsed
 * attachment text) is its {@code contentHash}, compared on each crawl to skip field extraction and
 * re-embedding of unchanged announcements.
 */
public final class ContentHasher {

  private ContentHasher() {
    // utility class
  }

  /**
   * @param content UTF-8 text, usually an announcement's analysis text
   * @return 64 lowercase hex characters
   */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** External identifier of a detail link: the hash of its normalized form. */
  public static String externalId(String detailLink) {
    return sha256(UrlNormalizer.normalize(detailLink));
  }
}
