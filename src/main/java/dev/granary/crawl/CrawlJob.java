package dev.granary.crawl;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * One crawl run of a source.
 *
 * <p>State changes go through {@link #start}, {@link #complete} and {@link #fail}; a job in a
 * terminal state rejects every further change with {@link IllegalStateException}.
 *
 * <p>Maps to the {@code crawl_jobs} table managed by Flyway migrations.
 *
 * @see CrawlJobStatus
 * @see CrawlJobRunner
 */
@Entity
@Table(name = "crawl_jobs")
public class CrawlJob {

    static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CrawlJobStatus status = CrawlJobStatus.PENDING;

    @Column(name = "projects_found", nullable = false)
    private int projectsFound;

    @Column(name = "projects_new", nullable = false)
    private int projectsNew;

    @Column(name = "projects_updated", nullable = false)
    private int projectsUpdated;

    @Column(name = "files_processed", nullable = false)
    private int filesProcessed;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected CrawlJob() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates a {@link CrawlJobStatus#PENDING} job.
     *
     * @param sourceId the source to crawl
     */
    public CrawlJob(UUID sourceId) {
        this.sourceId = sourceId;
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    /** Moves a pending job to {@link CrawlJobStatus#RUNNING}. */
    public void start(Instant now) {
        requireStatus(CrawlJobStatus.PENDING, CrawlJobStatus.RUNNING);
        this.status = CrawlJobStatus.RUNNING;
        this.startedAt = now;
    }

    /** Records the final counters of a running job. */
    public void complete(CrawlJobStats stats, Instant now) {
        requireStatus(CrawlJobStatus.RUNNING, CrawlJobStatus.COMPLETED);
        this.status = CrawlJobStatus.COMPLETED;
        this.projectsFound = stats.projectsFound();
        this.projectsNew = stats.projectsNew();
        this.projectsUpdated = stats.projectsUpdated();
        this.filesProcessed = stats.filesProcessed();
        this.completedAt = now;
    }

    /** Marks a pending or running job failed. */
    public void fail(String message, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Crawl job " + id + " is already " + status + ", cannot move to FAILED");
        }
        this.status = CrawlJobStatus.FAILED;
        this.errorMessage = truncate(message);
        this.completedAt = now;
    }

    private void requireStatus(CrawlJobStatus expected, CrawlJobStatus next) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Crawl job " + id + " is " + status + ", cannot move to " + next);
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH)
                : message;
    }

    /** Counters as recorded on the job. */
    public CrawlJobStats stats() {
        return new CrawlJobStats(projectsFound, projectsNew, projectsUpdated, filesProcessed);
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public CrawlJobStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
