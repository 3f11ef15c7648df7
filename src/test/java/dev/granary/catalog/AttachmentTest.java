package dev.granary.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.granary.fixture.AttachmentBuilder;
import org.junit.jupiter.api.Test;

class AttachmentTest {

  @Test
  void newAttachmentStartsUploaded() {
    Attachment attachment = new AttachmentBuilder().build();

    assertThat(attachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.UPLOADED);
    assertThat(attachment.isParsed()).isFalse();
  }

  @Test
  void successfulAnalysisStoresContent() {
    Attachment attachment = new AttachmentBuilder().build();

    attachment.startAnalysis(false);
    attachment.completeAnalysis("지원 대상: 중소기업");

    assertThat(attachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.ANALYZED);
    assertThat(attachment.isParsed()).isTrue();
    assertThat(attachment.getParsedContent()).isEqualTo("지원 대상: 중소기업");
    assertThat(attachment.getParseError()).isNull();
  }

  @Test
  void failedAnalysisRecordsErrorAndMayBeRetried() {
    Attachment attachment = new AttachmentBuilder().build();
    attachment.startAnalysis(false);
    attachment.failAnalysis("unsupported HWP version");

    assertThat(attachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.FAILED);
    assertThat(attachment.getParseError()).isEqualTo("unsupported HWP version");

    attachment.startAnalysis(false);

    assertThat(attachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.ANALYZING);
    assertThat(attachment.getParseError()).isNull();
  }

  @Test
  void analyzingRejectsAnotherStart() {
    Attachment attachment = new AttachmentBuilder().build();
    attachment.startAnalysis(false);

    assertThatThrownBy(() -> attachment.startAnalysis(true))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("ANALYZING");
  }

  @Test
  void analyzedRequiresForceToRestart() {
    Attachment attachment = new AttachmentBuilder().analyzed("본문").build();

    assertThatThrownBy(() -> attachment.startAnalysis(false))
        .isInstanceOf(IllegalStateException.class);

    attachment.startAnalysis(true);
    assertThat(attachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.ANALYZING);
  }

  @Test
  void draftWithAnalysisIsAppliedThroughStateMachine() {
    Attachment attachment = new AttachmentBuilder().analyzed("첫 분석").build();

    attachment.refresh(new AttachmentBuilder().analyzed("재분석").draft());

    assertThat(attachment.getAnalysisStatus()).isEqualTo(AnalysisStatus.ANALYZED);
    assertThat(attachment.getParsedContent()).isEqualTo("재분석");
  }

  @Test
  void refreshNeverClearsStoragePathOrKnownSize() {
    Attachment attachment =
        new AttachmentBuilder().storagePath("announcements/k/1_a.pdf").sizeBytes(100L).build();

    attachment.refresh(
        new AttachmentBuilder().storagePath(null).sizeBytes(null).fileName("새 이름.pdf").draft());

    assertThat(attachment.getStoragePath()).isEqualTo("announcements/k/1_a.pdf");
    assertThat(attachment.isStored()).isTrue();
    assertThat(attachment.getSizeBytes()).isEqualTo(100L);
    assertThat(attachment.getFileName()).isEqualTo("새 이름.pdf");
  }
}
