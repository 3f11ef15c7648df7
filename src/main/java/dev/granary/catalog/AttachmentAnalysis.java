package dev.granary.catalog;

import org.jspecify.annotations.Nullable;

/**
 * Result of analyzing one attachment's bytes.
 *
 * @param success whether the analyzer produced content
 * @param parsedContent extracted text on success
 * @param error failure description otherwise
 */
public record AttachmentAnalysis(
    boolean success, @Nullable String parsedContent, @Nullable String error) {

  public static AttachmentAnalysis parsed(String parsedContent) {
    return new AttachmentAnalysis(true, parsedContent, null);
  }

  public static AttachmentAnalysis failed(String error) {
    return new AttachmentAnalysis(false, null, error);
  }
}
