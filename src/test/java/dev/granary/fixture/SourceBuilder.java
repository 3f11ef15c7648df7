package dev.granary.fixture;

import dev.granary.source.AdapterType;
import dev.granary.source.Source;
import java.lang.reflect.Field;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link Source} JPA entity. Provides sensible defaults so tests
 * only override what they care about.
 *
 * <pre>{@code
 * Source source = new SourceBuilder().adapterType(AdapterType.BROWSER).build();
 * }</pre>
 */
public final class SourceBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private String url = "https://www.bizinfo.go.kr/web/lay1/bbs/S1T122C128/AS/74/list.do";
  private String name = "기업마당";
  private AdapterType adapterType = AdapterType.PLAIN;
  private boolean active = true;
  private @Nullable String waitSelector;
  private @Nullable String detailUrlTemplate;
  private @Nullable Instant lastCrawledAt;

  public SourceBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public SourceBuilder url(String url) {
    this.url = url;
    return this;
  }

  public SourceBuilder name(String name) {
    this.name = name;
    return this;
  }

  public SourceBuilder adapterType(AdapterType adapterType) {
    this.adapterType = adapterType;
    return this;
  }

  public SourceBuilder active(boolean active) {
    this.active = active;
    return this;
  }

  public SourceBuilder waitSelector(String waitSelector) {
    this.waitSelector = waitSelector;
    return this;
  }

  public SourceBuilder detailUrlTemplate(String detailUrlTemplate) {
    this.detailUrlTemplate = detailUrlTemplate;
    return this;
  }

  public SourceBuilder lastCrawledAt(Instant lastCrawledAt) {
    this.lastCrawledAt = lastCrawledAt;
    return this;
  }

  public Source build() {
    Source source = new Source(url, name);
    if (id != null) {
      setField(source, "id", id);
    }
    source.setAdapterType(adapterType);
    source.setActive(active);
    source.setWaitSelector(waitSelector);
    source.setDetailUrlTemplate(detailUrlTemplate);
    if (lastCrawledAt != null) {
      source.setLastCrawledAt(lastCrawledAt);
    }
    return source;
  }

  private static void setField(Source source, String fieldName, Object value) {
    try {
      Field field = Source.class.getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(source, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set field " + fieldName, e);
    }
  }
}
