package dev.granary.persistence;

/**
 * A persistence failure that survived the retry policy, tagged with its classification so the
 * caller can report it on the enclosing record.
 */
public class PersistenceFailureException extends RuntimeException {

  /** Whether the underlying failure was classified as transient. */
  public enum Kind {
    /** Retry budget exhausted on a transient failure. */
    TRANSIENT,
    /** Constraint violation, mapping error or any other non-retryable failure. */
    PERMANENT
  }

  private final Kind kind;

  public PersistenceFailureException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Wraps a failure that escaped the retry policy.
   *
   * @param operation label of the failed operation
   * @param cause the original failure
   * @return a classified exception
   */
  public static PersistenceFailureException classify(String operation, Throwable cause) {
    Kind kind = TransientErrorClassifier.isTransient(cause) ? Kind.TRANSIENT : Kind.PERMANENT;
    return new PersistenceFailureException(
        kind, operation + " failed (" + kind + "): " + cause.getMessage(), cause);
  }

  public Kind getKind() {
    return kind;
  }
}
