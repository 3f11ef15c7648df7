package dev.granary.api;

import dev.granary.dedup.GroupReviewService;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual review of duplicate groups.
 *
 * <ul>
 *   <li>{@code GET /api/groups/{id}} - group and live members
 *   <li>{@code PATCH /api/groups/{id}} - set the review status and/or the canonical member
 *   <li>{@code DELETE /api/groups/{id}} - dissolve the group, 204
 * </ul>
 */
@RestController
@RequestMapping("/api/groups")
public class GroupController {

  private final GroupReviewService groupReviewService;

  public GroupController(GroupReviewService groupReviewService) {
    this.groupReviewService = groupReviewService;
  }

  @GetMapping("/{id}")
  public ProjectGroupView get(@PathVariable UUID id) {
    return ProjectGroupView.from(groupReviewService.getGroup(id));
  }

  @PatchMapping("/{id}")
  public ProjectGroupView review(@PathVariable UUID id, @RequestBody GroupReviewRequest request) {
    return ProjectGroupView.from(
        groupReviewService.review(id, request.reviewStatus(), request.canonicalAnnouncementId()));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> dissolve(@PathVariable UUID id) {
    groupReviewService.dissolve(id);
    return ResponseEntity.noContent().build();
  }
}
