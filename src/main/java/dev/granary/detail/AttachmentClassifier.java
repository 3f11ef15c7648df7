package dev.granary.detail;

import dev.granary.catalog.AttachmentRole;
import dev.granary.catalog.AttachmentType;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Derives an attachment's type from its extension and its role from keywords in its file name.
 */
public final class AttachmentClassifier {

  private static final Pattern URL_EXTENSION = Pattern.compile("\\.(hwpx|hwp|pdf)(?=$|[?#&/;])");

  private static final List<String> ANNOUNCEMENT_KEYWORDS = List.of("공고", "모집", "안내");
  private static final List<String> APPLICATION_KEYWORDS = List.of("신청서", "지원서", "신청양식");
  private static final List<String> PLAN_KEYWORDS = List.of("사업계획서", "계획서");
  private static final List<String> EVALUATION_KEYWORDS = List.of("평가", "선정", "기준");

  private AttachmentClassifier() {
    // utility class
  }

  /**
   * Determines the file type from the file name's extension, falling back to the URL.
   *
   * @param fileName display name, may lack an extension
   * @param url download URL
   * @return the type, {@link AttachmentType#OTHER} when neither reveals one
   */
  public static AttachmentType typeOf(String fileName, @Nullable String url) {
    AttachmentType fromName = AttachmentType.fromExtension(extensionOf(fileName));
    if (fromName != AttachmentType.OTHER || url == null) {
      return fromName;
    }
    Matcher m = URL_EXTENSION.matcher(url.toLowerCase(Locale.ROOT));
    return m.find() ? AttachmentType.fromExtension(m.group(1)) : AttachmentType.OTHER;
  }

  /**
   * Guesses the attachment's purpose. Keyword groups are checked in priority order.
   *
   * @param fileName display name
   * @return the role, {@link AttachmentRole#OTHER} when no keyword matches
   */
  public static AttachmentRole roleOf(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    if (containsAny(lower, ANNOUNCEMENT_KEYWORDS)) {
      return AttachmentRole.ANNOUNCEMENT;
    }
    if (containsAny(lower, APPLICATION_KEYWORDS)) {
      return AttachmentRole.APPLICATION_FORM;
    }
    if (containsAny(lower, PLAN_KEYWORDS)) {
      return AttachmentRole.BUSINESS_PLAN;
    }
    if (containsAny(lower, EVALUATION_KEYWORDS)) {
      return AttachmentRole.EVALUATION;
    }
    return AttachmentRole.OTHER;
  }

  /** Analysis priority of a file name; higher is analyzed first. */
  public static int priorityOf(String fileName) {
    return roleOf(fileName).priority();
  }

  static @Nullable String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return null;
    }
    return fileName.substring(dot + 1).trim();
  }

  private static boolean containsAny(String text, List<String> keywords) {
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
