package dev.granary.analysis;

import dev.granary.catalog.AnnouncementFields;
import org.jspecify.annotations.Nullable;

/** Extracts structured announcement fields from free text. */
public interface AnnouncementFieldExtractor {

  /**
   * @param text detail page text, optionally followed by attachment text
   * @return the fields, or null when extraction failed
   */
  @Nullable
  AnnouncementFields extract(String text);
}
