package dev.granary.catalog;

/**
 * Analysis lifecycle of an {@link Attachment}.
 *
 * <p>Flow: {@code UPLOADED → ANALYZING → ANALYZED | FAILED}. A {@code FAILED} attachment may go
 * back to {@code ANALYZING} on a reanalysis request; an {@code ANALYZED} one only when the request
 * is forced. {@code ANALYZING} never restarts.
 */
public enum AnalysisStatus {
  /** Registered, not analyzed yet. */
  UPLOADED,
  /** Analysis in progress. */
  ANALYZING,
  /** Parsed content available. */
  ANALYZED,
  /** Analysis failed; see the parse error. */
  FAILED;

  /**
   * Checks a transition against the state machine.
   *
   * @param next target state
   * @param force whether the transition comes from a forced reanalysis
   * @return true when the transition is allowed
   */
  public boolean canTransitionTo(AnalysisStatus next, boolean force) {
    return switch (this) {
      case UPLOADED -> next == ANALYZING;
      case ANALYZING -> next == ANALYZED || next == FAILED;
      case FAILED -> next == ANALYZING;
      case ANALYZED -> next == ANALYZING && force;
    };
  }
}
