package dev.granary.detail;

import static org.assertj.core.api.Assertions.assertThat;

import dev.granary.catalog.AttachmentRole;
import dev.granary.catalog.AttachmentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AttachmentClassifierTest {

  @ParameterizedTest
  @CsvSource({
    "2024 모집공고.HWP, HWP",
    "신청서.hwpx, HWPX",
    "사업 안내.pdf, PDF",
    "포스터.jpg, OTHER",
    "첨부파일, OTHER"
  })
  void typeComesFromFileNameExtension(String fileName, AttachmentType expected) {
    assertThat(AttachmentClassifier.typeOf(fileName, null)).isEqualTo(expected);
  }

  @Test
  void urlExtensionIsUsedWhenNameHasNone() {
    assertThat(AttachmentClassifier.typeOf("다운로드", "https://x.kr/files/a.hwpx?v=2"))
        .isEqualTo(AttachmentType.HWPX);
    assertThat(AttachmentClassifier.typeOf("다운로드", "https://x.kr/files/a.pdf"))
        .isEqualTo(AttachmentType.PDF);
    assertThat(AttachmentClassifier.typeOf("다운로드", "https://x.kr/down.do?id=1"))
        .isEqualTo(AttachmentType.OTHER);
  }

  @Test
  void nameExtensionWinsOverUrl() {
    assertThat(AttachmentClassifier.typeOf("공고문.pdf", "https://x.kr/files/a.hwp"))
        .isEqualTo(AttachmentType.PDF);
  }

  @ParameterizedTest
  @CsvSource({
    "2024년 창업지원 모집공고.pdf, ANNOUNCEMENT",
    "참가 신청서.hwp, APPLICATION_FORM",
    "사업계획서.hwp, BUSINESS_PLAN",
    "평가 기준표.pdf, EVALUATION",
    "로고.png, OTHER"
  })
  void roleComesFromKeywords(String fileName, AttachmentRole expected) {
    assertThat(AttachmentClassifier.roleOf(fileName)).isEqualTo(expected);
  }

  @Test
  void announcementKeywordsTakePriority() {
    assertThat(AttachmentClassifier.roleOf("신청서 작성 안내.hwp"))
        .isEqualTo(AttachmentRole.ANNOUNCEMENT);
    assertThat(AttachmentClassifier.priorityOf("공고문.pdf"))
        .isGreaterThan(AttachmentClassifier.priorityOf("신청서.hwp"));
  }

  @Test
  void extensionOfHandlesMissingAndTrailingDots() {
    assertThat(AttachmentClassifier.extensionOf("file")).isNull();
    assertThat(AttachmentClassifier.extensionOf("file.")).isNull();
    assertThat(AttachmentClassifier.extensionOf("a.b.pdf")).isEqualTo("pdf");
  }
}
