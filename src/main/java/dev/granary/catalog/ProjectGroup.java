package dev.granary.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * A cluster of announcements describing the same program, published by several sources.
 * Exactly one member is canonical; its id is mirrored in {@code canonicalAnnouncementId}.
 */
@Entity
@Table(name = "project_groups")
public class ProjectGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_status", nullable = false)
    private GroupReviewStatus reviewStatus = GroupReviewStatus.AUTO_GROUPED;

    @Column(name = "canonical_announcement_id")
    private UUID canonicalAnnouncementId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ProjectGroup() {
        // auto-grouped until a member disagreement is found
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /** Marks the group for manual review. Reviewed or confirmed groups keep their status. */
    public void flagForReview() {
        if (reviewStatus == GroupReviewStatus.AUTO_GROUPED) {
            reviewStatus = GroupReviewStatus.PENDING_REVIEW;
        }
    }

    /** Operator decision; any status may be set, including back to auto-grouped. */
    public void review(GroupReviewStatus status) {
        this.reviewStatus = status;
    }

    public void setCanonicalAnnouncementId(UUID canonicalAnnouncementId) {
        this.canonicalAnnouncementId = canonicalAnnouncementId;
    }

    public UUID getId() {
        return id;
    }

    public GroupReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    public UUID getCanonicalAnnouncementId() {
        return canonicalAnnouncementId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
