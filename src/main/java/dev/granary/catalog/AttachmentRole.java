package dev.granary.catalog;

/**
 * What an attachment is for, guessed from its file name. The priority orders analysis work when
 * several attachments are parseable.
 */
public enum AttachmentRole {
  /** The announcement itself (공고문, 모집 안내). */
  ANNOUNCEMENT("announcement", 100),
  /** Application form (신청서, 지원서). */
  APPLICATION_FORM("application_form", 80),
  /** Business plan template (사업계획서). */
  BUSINESS_PLAN("business_plan", 70),
  /** Evaluation or selection criteria. */
  EVALUATION("evaluation", 60),
  OTHER("other", 10);

  private final String documentType;
  private final int priority;

  AttachmentRole(String documentType, int priority) {
    this.documentType = documentType;
    this.priority = priority;
  }

  /** Document type label sent to the analyzer. */
  public String documentType() {
    return documentType;
  }

  public int priority() {
    return priority;
  }
}
