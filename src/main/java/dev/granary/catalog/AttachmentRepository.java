package dev.granary.catalog;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Attachment} entities. */
public interface AttachmentRepository extends JpaRepository<Attachment, UUID> {

  List<Attachment> findByAnnouncementId(UUID announcementId);
}
