package dev.granary.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * File-system backed {@link AttachmentStorage}.
 *
 * <p>Files are written to {@code announcements/{announcementKey}/{timestamp}_{random}.{ext}} under
 * the configured root. Download URLs point at {@code /files/{path}} and carry an expiry and an
 * HMAC-SHA256 signature over {@code path} and expiry.
 */
@Component
public class LocalAttachmentStorage implements AttachmentStorage {

  private static final Logger log = LoggerFactory.getLogger(LocalAttachmentStorage.class);

  private static final String HMAC = "HmacSHA256";
  private static final Pattern UNSAFE_KEY = Pattern.compile("[^A-Za-z0-9_-]");
  private static final Pattern EXTENSION = Pattern.compile("[a-z0-9]{1,8}");
  private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

  private final Path root;
  private final byte[] secret;
  private final String publicBaseUrl;
  private final long ttlSeconds;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  public LocalAttachmentStorage(StorageProperties properties, Clock clock) {
    this.root = Path.of(properties.root()).toAbsolutePath().normalize();
    this.secret = properties.signingSecret().getBytes(StandardCharsets.UTF_8);
    this.publicBaseUrl = stripTrailingSlash(properties.publicBaseUrl());
    this.ttlSeconds = properties.signedUrlTtlSeconds();
    this.clock = clock;
  }

  @Override
  public StoredFile upload(StorageUpload upload) {
    String path =
        "announcements/"
            + safeKey(upload.announcementKey())
            + "/"
            + clock.millis()
            + "_"
            + randomId()
            + "."
            + extension(upload.fileName());
    Path target = resolve(path);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, upload.bytes());
    } catch (IOException e) {
      log.warn("Failed to store {} ({} bytes): {}", path, upload.bytes().length, e.getMessage());
      return StoredFile.failed("write failed: " + e.getMessage());
    }
    log.debug("Stored {} ({} bytes)", path, upload.bytes().length);
    return StoredFile.stored(path, signedUrl(path, ttlSeconds));
  }

  @Override
  public String signedUrl(String path, long ttlSeconds) {
    long expires = clock.instant().getEpochSecond() + ttlSeconds;
    return publicBaseUrl
        + "/files/"
        + path
        + "?expires="
        + expires
        + "&signature="
        + sign(path, expires);
  }

  /**
   * Checks a download URL's signature and expiry.
   *
   * @param path storage path from the URL
   * @param expires expiry epoch second from the URL
   * @param signature signature from the URL
   * @return true when the signature matches and the URL has not expired
   */
  public boolean verify(String path, long expires, String signature) {
    if (clock.instant().getEpochSecond() > expires) {
      return false;
    }
    byte[] expected = sign(path, expires).getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII));
  }

  @Override
  public byte[] read(String path) {
    try {
      return Files.readAllBytes(resolve(path));
    } catch (NoSuchFileException e) {
      throw new StorageException("Stored file not found: " + path, e);
    } catch (IOException e) {
      throw new StorageException("Failed to read stored file " + path, e);
    }
  }

  @Override
  public void delete(String path) {
    try {
      Files.deleteIfExists(resolve(path));
    } catch (IOException e) {
      throw new StorageException("Failed to delete stored file " + path, e);
    }
  }

  private Path resolve(String path) {
    Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root)) {
      throw new IllegalArgumentException("Path escapes storage root: " + path);
    }
    return resolved;
  }

  private String sign(String path, long expires) {
    try {
      Mac mac = Mac.getInstance(HMAC);
      mac.init(new SecretKeySpec(secret, HMAC));
      byte[] digest = mac.doFinal((path + "\n" + expires).getBytes(StandardCharsets.UTF_8));
      return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }

  private String randomId() {
    char[] id = new char[8];
    for (int i = 0; i < id.length; i++) {
      id[i] = ALPHABET[random.nextInt(ALPHABET.length)];
    }
    return new String(id);
  }

  static String safeKey(String key) {
    String safe = UNSAFE_KEY.matcher(key).replaceAll("_");
    return safe.isEmpty() ? "_" : safe;
  }

  static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0) {
      return "bin";
    }
    String ext = fileName.substring(dot + 1).strip().toLowerCase(Locale.ROOT);
    return EXTENSION.matcher(ext).matches() ? ext : "bin";
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
