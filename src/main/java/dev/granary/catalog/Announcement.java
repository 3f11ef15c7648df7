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
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A support-program announcement collected from one source.
 *
 * <p>Identity is {@code (sourceId, externalId)}. The fingerprint columns
 * ({@code normalizedName}, {@code normalizedOrg}) drive deduplication: when they change the
 * row is handed back to the dedup backlog by clearing {@code dedupedAt}; so is a grouped row
 * whose deadline changes, since the deadline decides the canonical member. A changed
 * {@code contentHash} marks the search embeddings stale.
 *
 * <p>Maps to the {@code announcements} table managed by Flyway migrations.
 *
 * @see ProjectGroup
 * @see AnnouncementRepository
 */
@Entity
@Table(name = "announcements")
public class Announcement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(nullable = false)
    private String name;

    private String organization;

    private String category;

    private String region;

    @Column(name = "amount_min")
    private Long amountMin;

    @Column(name = "amount_max")
    private Long amountMax;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    private LocalDate deadline;

    @Column(nullable = false)
    private boolean permanent;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String eligibility;

    @Column(name = "application_process", columnDefinition = "TEXT")
    private String applicationProcess;

    @Column(name = "evaluation_criteria", columnDefinition = "TEXT")
    private String evaluationCriteria;

    @Column(name = "contact_info", columnDefinition = "TEXT")
    private String contactInfo;

    @Column(name = "detail_url", nullable = false)
    private String detailUrl;

    @Column(name = "posted_date")
    private LocalDate postedDate;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @Column(name = "normalized_org", nullable = false)
    private String normalizedOrg;

    @Column(name = "group_id")
    private UUID groupId;

    @Column(name = "is_canonical", nullable = false)
    private boolean canonical = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AnnouncementStatus status = AnnouncementStatus.ACTIVE;

    @Column(name = "view_count", nullable = false)
    private int viewCount;

    @Column(name = "bookmark_count", nullable = false)
    private int bookmarkCount;

    @Column(name = "content_hash", nullable = false)
    private String contentHash;

    @Column(name = "embedding_stale", nullable = false)
    private boolean embeddingStale = true;

    @Column(name = "deduped_at")
    private Instant dedupedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Announcement() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an announcement that is not yet part of any group.
     *
     * @param sourceId   owning source
     * @param externalId stable identifier within the source
     */
    public Announcement(UUID sourceId, String externalId) {
        this.sourceId = sourceId;
        this.externalId = externalId;
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

    /**
     * Applies a crawled draft. Listing-level values always overwrite; extracted fields only
     * overwrite when present so a failed extraction never erases earlier data.
     *
     * @param draft the crawled state
     * @param today used to derive {@link AnnouncementStatus#CLOSED}
     */
    public void applyDraft(AnnouncementDraft draft, LocalDate today) {
        this.name = draft.name();
        if (draft.organization() != null) {
            this.organization = draft.organization();
        }
        if (draft.postedDate() != null) {
            this.postedDate = draft.postedDate();
        }
        this.detailUrl = draft.detailUrl();
        if (!draft.contentHash().equals(this.contentHash)) {
            this.contentHash = draft.contentHash();
            this.embeddingStale = true;
        }
        if (draft.fields() != null) {
            applyFields(draft.fields());
        }
        updateFingerprint(draft.normalizedName(), draft.normalizedOrg());
        this.status = deriveStatus(today);
    }

    private void applyFields(AnnouncementFields fields) {
        summary = pick(fields.summary(), summary);
        description = pick(fields.description(), description);
        eligibility = pick(fields.eligibility(), eligibility);
        applicationProcess = pick(fields.applicationProcess(), applicationProcess);
        evaluationCriteria = pick(fields.evaluationCriteria(), evaluationCriteria);
        contactInfo = pick(fields.contactInfo(), contactInfo);
        if (organization == null) {
            organization = fields.organization();
        }
        category = pick(fields.category(), category);
        region = pick(fields.region(), region);
        amountMin = pick(fields.amountMin(), amountMin);
        amountMax = pick(fields.amountMax(), amountMax);
        startDate = pick(fields.startDate(), startDate);
        endDate = pick(fields.endDate(), endDate);
        LocalDate newDeadline = pick(fields.deadline(), deadline);
        if (groupId != null && !Objects.equals(newDeadline, deadline)) {
            // the deadline ranks canonical candidates
            dedupedAt = null;
        }
        deadline = newDeadline;
        if (fields.permanent() != null) {
            permanent = fields.permanent();
        }
    }

    private static <T> T pick(T incoming, T current) {
        return incoming != null ? incoming : current;
    }

    /**
     * Replaces the fingerprint. A changed fingerprint returns the row to the dedup backlog.
     *
     * @return true if either part changed
     */
    public boolean updateFingerprint(String newName, String newOrg) {
        boolean changed = !Objects.equals(normalizedName, newName)
                || !Objects.equals(normalizedOrg, newOrg);
        if (changed) {
            this.normalizedName = newName;
            this.normalizedOrg = newOrg;
            this.dedupedAt = null;
        }
        return changed;
    }

    private AnnouncementStatus deriveStatus(LocalDate today) {
        if (status == AnnouncementStatus.DRAFT) {
            return status;
        }
        if (!permanent && deadline != null && deadline.isBefore(today)) {
            return AnnouncementStatus.CLOSED;
        }
        return AnnouncementStatus.ACTIVE;
    }

    /**
     * Copies fields that are empty here but present on {@code other}. Used when a
     * duplicate carries data the canonical announcement lacks.
     *
     * @return true if anything was copied
     */
    public boolean mergeMissingFrom(Announcement other) {
        boolean changed = false;
        if (summary == null && other.summary != null) {
            summary = other.summary;
            changed = true;
        }
        if (description == null && other.description != null) {
            description = other.description;
            changed = true;
        }
        if (eligibility == null && other.eligibility != null) {
            eligibility = other.eligibility;
            changed = true;
        }
        if (applicationProcess == null && other.applicationProcess != null) {
            applicationProcess = other.applicationProcess;
            changed = true;
        }
        if (evaluationCriteria == null && other.evaluationCriteria != null) {
            evaluationCriteria = other.evaluationCriteria;
            changed = true;
        }
        if (contactInfo == null && other.contactInfo != null) {
            contactInfo = other.contactInfo;
            changed = true;
        }
        if (amountMin == null && other.amountMin != null) {
            amountMin = other.amountMin;
            changed = true;
        }
        if (amountMax == null && other.amountMax != null) {
            amountMax = other.amountMax;
            changed = true;
        }
        if (deadline == null && other.deadline != null) {
            deadline = other.deadline;
            changed = true;
        }
        if (changed) {
            embeddingStale = true;
        }
        return changed;
    }

    /** Assigns this announcement to a group and records whether it represents the group. */
    public void assignGroup(UUID groupId, boolean canonical) {
        this.groupId = groupId;
        this.canonical = canonical;
    }

    public void markDeduped(Instant when) {
        this.dedupedAt = when;
    }

    public void markEmbedded() {
        this.embeddingStale = false;
    }

    /** Flags the search chunks for re-indexing, e.g. after an attachment was reanalyzed. */
    public void markEmbeddingStale() {
        this.embeddingStale = true;
    }

    /** Soft-deletes the announcement and takes it out of its group. */
    public void markDeleted(Instant when) {
        this.deletedAt = when;
        this.groupId = null;
        this.canonical = true;
    }

    /** Hands the announcement back to the dedup backlog without changing its fingerprint. */
    public void requeueForDedup() {
        this.dedupedAt = null;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getName() {
        return name;
    }

    public String getOrganization() {
        return organization;
    }

    public String getCategory() {
        return category;
    }

    public String getRegion() {
        return region;
    }

    public Long getAmountMin() {
        return amountMin;
    }

    public Long getAmountMax() {
        return amountMax;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public LocalDate getDeadline() {
        return deadline;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public String getSummary() {
        return summary;
    }

    public String getDescription() {
        return description;
    }

    public String getEligibility() {
        return eligibility;
    }

    public String getApplicationProcess() {
        return applicationProcess;
    }

    public String getEvaluationCriteria() {
        return evaluationCriteria;
    }

    public String getContactInfo() {
        return contactInfo;
    }

    public String getDetailUrl() {
        return detailUrl;
    }

    public LocalDate getPostedDate() {
        return postedDate;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getNormalizedOrg() {
        return normalizedOrg;
    }

    public UUID getGroupId() {
        return groupId;
    }

    public boolean isCanonical() {
        return canonical;
    }

    public AnnouncementStatus getStatus() {
        return status;
    }

    public int getViewCount() {
        return viewCount;
    }

    public int getBookmarkCount() {
        return bookmarkCount;
    }

    public String getContentHash() {
        return contentHash;
    }

    public boolean isEmbeddingStale() {
        return embeddingStale;
    }

    public Instant getDedupedAt() {
        return dedupedAt;
    }

    public Instant getDeletedAt() {
        return deletedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
