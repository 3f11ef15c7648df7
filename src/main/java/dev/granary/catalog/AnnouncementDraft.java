package dev.granary.catalog;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Everything the crawl pipeline knows about one announcement, ready to upsert.
 *
 * @param sourceId owning source
 * @param externalId stable identifier within the source
 * @param name announcement title
 * @param organization issuing organization, if known
 * @param postedDate date shown on the listing, if any
 * @param detailUrl detail page URL
 * @param contentHash hash of the text the fields were extracted from
 * @param normalizedName fingerprint name part
 * @param normalizedOrg fingerprint organization part
 * @param fields extracted fields; null when extraction was skipped or failed
 */
public record AnnouncementDraft(
    UUID sourceId,
    String externalId,
    String name,
    @Nullable String organization,
    @Nullable LocalDate postedDate,
    String detailUrl,
    String contentHash,
    String normalizedName,
    String normalizedOrg,
    @Nullable AnnouncementFields fields) {

  public AnnouncementDraft {
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    Objects.requireNonNull(externalId, "externalId must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(detailUrl, "detailUrl must not be null");
    Objects.requireNonNull(contentHash, "contentHash must not be null");
    Objects.requireNonNull(normalizedName, "normalizedName must not be null");
    Objects.requireNonNull(normalizedOrg, "normalizedOrg must not be null");
  }
}
