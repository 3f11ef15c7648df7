package dev.granary.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalysisResultTest {

  @Test
  void plainTextWinsOverSummary() {
    AnalysisResult result =
        new AnalysisResult(true, Map.of("text", "본문 전체"), "요약", List.of("a"), 0.8, null);

    assertThat(result.extractedText()).isEqualTo("본문 전체");
  }

  @Test
  void summaryAndInsightsAreUsedWhenTextIsBlank() {
    AnalysisResult result =
        new AnalysisResult(
            true, Map.of("text", " "), null, List.of("마감 4월 30일", "최대 5천만원"), null, null);

    assertThat(result.extractedText()).isEqualTo("- 마감 4월 30일\n- 최대 5천만원");
  }

  @Test
  void failureHasNoText() {
    assertThat(AnalysisResult.failure("boom").extractedText()).isNull();
  }
}
