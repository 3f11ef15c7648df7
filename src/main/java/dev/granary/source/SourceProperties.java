package dev.granary.source;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configured crawl sources bound from {@code granary.sources}.
 *
 * @param sources the portals to crawl; an absent list means none
 */
@ConfigurationProperties(prefix = "granary")
public record SourceProperties(@Nullable List<Entry> sources) {

  public SourceProperties {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  /**
   * One configured portal.
   *
   * @param name display name, also the organization fallback for its announcements
   * @param url listing page URL
   * @param type fetch adapter; {@code plain} when absent
   * @param active whether scheduled batches include the source; true when absent
   * @param waitSelector CSS selector the browser waits for before capturing the listing
   * @param detailUrlTemplate detail URL pattern for script-driven boards, {@code {id}} placeholder
   */
  public record Entry(
      String name,
      String url,
      @Nullable AdapterType type,
      @Nullable Boolean active,
      @Nullable String waitSelector,
      @Nullable String detailUrlTemplate) {

    public Entry {
      if (url == null || url.isBlank()) {
        throw new IllegalArgumentException("granary.sources[].url must not be blank");
      }
      if (name == null || name.isBlank()) {
        name = url;
      }
      if (type == null) {
        type = AdapterType.PLAIN;
      }
      if (active == null) {
        active = Boolean.TRUE;
      }
    }
  }
}
