package dev.granary.ingestion;

import java.util.Locale;

/** Kind of catalog record an indexed chunk belongs to. */
public enum IndexSourceType {
  ANNOUNCEMENT("announcement"),
  ATTACHMENT("attachment");

  private final String value;

  IndexSourceType(String value) {
    this.value = value;
  }

  /** Value stored in the {@code source_type} metadata key. */
  public String value() {
    return value;
  }

  /**
   * Parses a metadata or request value.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static IndexSourceType fromValue(String value) {
    for (IndexSourceType type : values()) {
      if (type.value.equals(value.toLowerCase(Locale.ROOT))) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown source type: " + value);
  }
}
