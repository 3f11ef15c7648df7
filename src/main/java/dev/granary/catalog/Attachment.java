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
 * A file linked from an announcement's detail page.
 *
 * <p>{@code storagePath != null} means the bytes were stored and can be read back from
 * attachment storage; otherwise only the remote {@code sourceUrl} is known and the file must be
 * downloaded again for analysis.
 *
 * <p>Analysis progress follows {@link AnalysisStatus}. Transitions not permitted by the state
 * machine throw {@link IllegalStateException}.
 */
@Entity
@Table(name = "attachments")
public class Attachment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "announcement_id", nullable = false)
    private UUID announcementId;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_type", nullable = false)
    private AttachmentType fileType;

    @Column(name = "mime_type")
    private String mimeType;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttachmentRole role = AttachmentRole.OTHER;

    @Column(name = "source_url", nullable = false)
    private String sourceUrl;

    @Column(name = "storage_path")
    private String storagePath;

    @Column(name = "should_parse", nullable = false)
    private boolean shouldParse;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_status", nullable = false)
    private AnalysisStatus analysisStatus = AnalysisStatus.UPLOADED;

    @Column(nullable = false)
    private boolean parsed;

    @Column(name = "parsed_content", columnDefinition = "TEXT")
    private String parsedContent;

    @Column(name = "parse_error", columnDefinition = "TEXT")
    private String parseError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Attachment() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an attachment in {@link AnalysisStatus#UPLOADED} state.
     *
     * @param announcementId owning announcement
     * @param draft          what the crawl observed
     */
    public Attachment(UUID announcementId, AttachmentDraft draft) {
        this.announcementId = announcementId;
        this.sourceUrl = draft.sourceUrl();
        refresh(draft);
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
     * Updates descriptive fields from a re-crawl. A stored path is never cleared by a later
     * crawl that skipped storage. An attached analysis result is applied through the state
     * machine.
     */
    public void refresh(AttachmentDraft draft) {
        this.fileName = draft.fileName();
        this.fileType = draft.type();
        this.mimeType = draft.mimeType();
        this.role = draft.role();
        if (draft.sizeBytes() != null) {
            this.sizeBytes = draft.sizeBytes();
        }
        this.shouldParse = draft.shouldParse();
        if (draft.storagePath() != null) {
            this.storagePath = draft.storagePath();
        }
        AttachmentAnalysis analysis = draft.analysis();
        if (analysis != null && analysisStatus != AnalysisStatus.ANALYZING) {
            startAnalysis(analysisStatus == AnalysisStatus.ANALYZED);
            if (analysis.success()) {
                completeAnalysis(analysis.parsedContent());
            } else {
                failAnalysis(analysis.error());
            }
        }
    }

    /**
     * Moves to {@link AnalysisStatus#ANALYZING}.
     *
     * @param force permits leaving {@link AnalysisStatus#ANALYZED}
     * @throws IllegalStateException when the transition is not allowed
     */
    public void startAnalysis(boolean force) {
        transition(AnalysisStatus.ANALYZING, force);
        this.parseError = null;
    }

    public void completeAnalysis(String content) {
        transition(AnalysisStatus.ANALYZED, false);
        this.parsed = true;
        this.parsedContent = content;
        this.parseError = null;
    }

    public void failAnalysis(String error) {
        transition(AnalysisStatus.FAILED, false);
        this.parsed = false;
        this.parseError = error;
    }

    private void transition(AnalysisStatus next, boolean force) {
        if (!analysisStatus.canTransitionTo(next, force)) {
            throw new IllegalStateException(
                    "Attachment " + id + " cannot move from " + analysisStatus + " to " + next);
        }
        this.analysisStatus = next;
    }

    public boolean isStored() {
        return storagePath != null;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAnnouncementId() {
        return announcementId;
    }

    public String getFileName() {
        return fileName;
    }

    public AttachmentType getFileType() {
        return fileType;
    }

    public String getMimeType() {
        return mimeType;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public AttachmentRole getRole() {
        return role;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getStoragePath() {
        return storagePath;
    }

    public boolean isShouldParse() {
        return shouldParse;
    }

    public AnalysisStatus getAnalysisStatus() {
        return analysisStatus;
    }

    public boolean isParsed() {
        return parsed;
    }

    public String getParsedContent() {
        return parsedContent;
    }

    public String getParseError() {
        return parseError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
