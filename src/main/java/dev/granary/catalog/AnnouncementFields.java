package dev.granary.catalog;

import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * Structured fields extracted from an announcement's text by the field extractor. Every field is
 * optional; null means "not found" and leaves the stored value untouched.
 *
 * @param summary one-paragraph summary
 * @param description program description
 * @param eligibility who may apply
 * @param applicationProcess how to apply
 * @param evaluationCriteria how applications are scored
 * @param contactInfo contact person, phone or e-mail
 * @param organization issuing organization
 * @param category program category (인력, 수출, 창업, 기술, 자금, ...)
 * @param region target region (전국, 서울, 경기, ...)
 * @param amountMin minimum support amount in KRW
 * @param amountMax maximum support amount in KRW
 * @param startDate application window start
 * @param endDate application window end
 * @param deadline application deadline
 * @param permanent true for rolling programs without a deadline
 */
public record AnnouncementFields(
    @Nullable String summary,
    @Nullable String description,
    @Nullable String eligibility,
    @Nullable String applicationProcess,
    @Nullable String evaluationCriteria,
    @Nullable String contactInfo,
    @Nullable String organization,
    @Nullable String category,
    @Nullable String region,
    @Nullable Long amountMin,
    @Nullable Long amountMax,
    @Nullable LocalDate startDate,
    @Nullable LocalDate endDate,
    @Nullable LocalDate deadline,
    @Nullable Boolean permanent) {

  /** Copy with category and region replaced by their normalized values. */
  public AnnouncementFields withClassification(String normalizedCategory, String normalizedRegion) {
    return new AnnouncementFields(
        summary,
        description,
        eligibility,
        applicationProcess,
        evaluationCriteria,
        contactInfo,
        organization,
        normalizedCategory,
        normalizedRegion,
        amountMin,
        amountMax,
        startDate,
        endDate,
        deadline,
        permanent);
  }
}
