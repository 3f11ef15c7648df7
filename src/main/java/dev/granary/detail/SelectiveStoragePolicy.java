package dev.granary.detail;

import dev.granary.catalog.AttachmentType;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Decides which attachments are worth storing and analyzing: parseable document types whose
 * names mark them as substantive (announcement, application, plan, criteria) and not as
 * templates or imagery, below the size ceiling.
 */
@Component
public class SelectiveStoragePolicy {

  static final List<String> INCLUDE_KEYWORDS =
      List.of(
          "공고", "공고문", "모집", "안내", "요강", "지침", "신청서", "사업계획서", "지원서", "평가기준", "선정기준",
          "참가신청");

  static final List<String> EXCLUDE_KEYWORDS =
      List.of("템플릿", "서식", "양식 샘플", "로고", "이미지", "배너", "썸네일", "포스터", "사진");

  /** English exclusions match whole words only: "form" but not "platform" or "information". */
  static final Pattern EXCLUDE_WORDS =
      Pattern.compile("(?<![a-z])(template|form|logo|banner|poster|image|photo)s?(?![a-z])");

  private final long maxStoredBytes;

  public SelectiveStoragePolicy(AttachmentProperties properties) {
    this.maxStoredBytes = properties.maxStoredBytes();
  }

  /**
   * Whether an attachment should be stored and analyzed.
   *
   * @param fileName display file name
   * @param type file type
   * @param sizeBytes known size, or null when unknown (the download enforces the ceiling)
   * @return true only for substantive, parseable, small enough documents
   */
  public boolean shouldParse(String fileName, AttachmentType type, @Nullable Long sizeBytes) {
    if (!type.isParseable()) {
      return false;
    }
    if (sizeBytes != null && sizeBytes >= maxStoredBytes) {
      return false;
    }
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (String keyword : EXCLUDE_KEYWORDS) {
      if (lower.contains(keyword)) {
        return false;
      }
    }
    if (EXCLUDE_WORDS.matcher(lower).find()) {
      return false;
    }
    for (String keyword : INCLUDE_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  public long maxStoredBytes() {
    return maxStoredBytes;
  }
}
