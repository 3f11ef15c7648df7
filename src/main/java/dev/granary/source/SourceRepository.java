package dev.granary.source;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Source} entities. */
public interface SourceRepository extends JpaRepository<Source, UUID> {

  List<Source> findAllByActiveTrueOrderByNameAsc();

  Optional<Source> findByUrl(String url);
}
