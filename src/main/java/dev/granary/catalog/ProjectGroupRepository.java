package dev.granary.catalog;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ProjectGroup} entities. */
public interface ProjectGroupRepository extends JpaRepository<ProjectGroup, UUID> {}
