package dev.granary.analysis;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Response of the document analyzer.
 *
 * @param success whether the document could be read
 * @param extractedData structured data; {@code text} holds the document's plain text when present
 * @param summary short summary
 * @param keyInsights notable points
 * @param confidenceScore analyzer confidence in [0, 1]
 * @param error failure description
 */
public record AnalysisResult(
    boolean success,
    @Nullable Map<String, Object> extractedData,
    @Nullable String summary,
    @Nullable List<String> keyInsights,
    @Nullable Double confidenceScore,
    @Nullable String error) {

  public static AnalysisResult failure(String error) {
    return new AnalysisResult(false, null, null, null, null, error);
  }

  /**
   * Text to store as the attachment's parsed content: the extracted plain text, or the summary
   * and key insights when the analyzer returned no text.
   */
  public @Nullable String extractedText() {
    if (extractedData != null && extractedData.get("text") instanceof String text
        && !text.isBlank()) {
      return text;
    }
    StringBuilder sb = new StringBuilder();
    if (summary != null && !summary.isBlank()) {
      sb.append(summary.strip());
    }
    if (keyInsights != null) {
      for (String insight : keyInsights) {
        if (sb.length() > 0) {
          sb.append('\n');
        }
        sb.append("- ").append(insight);
      }
    }
    return sb.length() == 0 ? null : sb.toString();
  }
}
