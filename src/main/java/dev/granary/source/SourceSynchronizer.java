package dev.granary.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates or updates {@link Source} rows from {@code granary.sources} at startup, matching by URL.
 * Sources present in the database but absent from configuration are left untouched.
 */
@Component
public class SourceSynchronizer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(SourceSynchronizer.class);

  private final SourceRepository sourceRepository;
  private final SourceProperties properties;

  public SourceSynchronizer(SourceRepository sourceRepository, SourceProperties properties) {
    this.sourceRepository = sourceRepository;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    synchronize();
  }

  /**
   * Applies the configured sources.
   *
   * @return number of sources created
   */
  public int synchronize() {
    int created = 0;
    for (SourceProperties.Entry entry : properties.sources()) {
      Source source = sourceRepository.findByUrl(entry.url()).orElse(null);
      if (source == null) {
        source = new Source(entry.url(), entry.name());
        created++;
      }
      source.setName(entry.name());
      source.setAdapterType(entry.type());
      source.setActive(entry.active());
      source.setWaitSelector(entry.waitSelector());
      source.setDetailUrlTemplate(entry.detailUrlTemplate());
      sourceRepository.save(source);
    }
    log.info(
        "Synchronized {} configured sources ({} new)", properties.sources().size(), created);
    return created;
  }
}
