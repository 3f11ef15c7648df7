package dev.granary.persistence;

import java.sql.SQLTransientException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

/**
 * Decides whether a persistence failure is worth retrying.
 *
 * <p>A failure is transient when any exception in its cause chain is a Spring {@link
 * TransientDataAccessException}, a {@link CannotGetJdbcConnectionException}, a JDBC {@link
 * SQLTransientException}, or carries a message matching one of the connection-pool exhaustion or
 * timeout signatures.
 */
public final class TransientErrorClassifier {

  private static final List<String> TRANSIENT_SIGNATURES =
      List.of(
          "connection pool",
          "connection is not available",
          "unable to acquire jdbc connection",
          "too many connections",
          "remaining connection slots are reserved",
          "connection reset",
          "timed out",
          "timeout expired",
          "statement timeout",
          "canceling statement due to lock timeout");

  private TransientErrorClassifier() {
    // utility class
  }

  /**
   * Classifies a failure by walking its cause chain.
   *
   * @param error the failure to classify, may be null
   * @return true if the failure matches a transient type or message signature
   */
  public static boolean isTransient(Throwable error) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = error;
    while (current != null && seen.add(current)) {
      if (current instanceof TransientDataAccessException
          || current instanceof CannotGetJdbcConnectionException
          || current instanceof SQLTransientException) {
        return true;
      }
      if (matchesSignature(current.getMessage())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private static boolean matchesSignature(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return TRANSIENT_SIGNATURES.stream().anyMatch(lower::contains);
  }
}
