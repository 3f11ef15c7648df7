package dev.granary.catalog;

import java.util.Locale;

/** File type taxonomy for attachments, derived from the file extension. */
public enum AttachmentType {
  HWP("hwp", "application/x-hwp"),
  HWPX("hwpx", "application/vnd.hancom.hwpx"),
  PDF("pdf", "application/pdf"),
  OTHER("other", "application/octet-stream");

  private final String value;
  private final String mimeType;

  AttachmentType(String value, String mimeType) {
    this.value = value;
    this.mimeType = mimeType;
  }

  public String value() {
    return value;
  }

  public String mimeType() {
    return mimeType;
  }

  /** Whether the document analyzer can read this type. */
  public boolean isParseable() {
    return this != OTHER;
  }

  /**
   * Maps a file extension (without the dot, any case) to a type.
   *
   * @param extension extension such as {@code "PDF"}
   * @return the matching type, {@link #OTHER} when unknown
   */
  public static AttachmentType fromExtension(String extension) {
    if (extension == null) {
      return OTHER;
    }
    return switch (extension.toLowerCase(Locale.ROOT)) {
      case "hwp" -> HWP;
      case "hwpx" -> HWPX;
      case "pdf" -> PDF;
      default -> OTHER;
    };
  }
}
