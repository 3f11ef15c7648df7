package dev.granary.source;

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
 * A portal whose announcement listing is crawled.
 *
 * <p>Each source tracks its listing URL (unique), the adapter used to fetch it and the optional
 * hints the browser path and the listing extractor need. Rows are created from
 * {@code granary.sources} at startup by {@link SourceSynchronizer} and stamped with
 * {@code lastCrawledAt} after each run.
 *
 * <p>Maps to the {@code sources} table managed by Flyway migrations.
 *
 * @see AdapterType
 * @see SourceRepository
 */
@Entity
@Table(name = "sources")
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String url;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "adapter_type", nullable = false)
    private AdapterType adapterType = AdapterType.PLAIN;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "wait_selector")
    private String waitSelector;

    @Column(name = "detail_url_template")
    private String detailUrlTemplate;

    @Column(name = "last_crawled_at")
    private Instant lastCrawledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Source() {
        // JPA requires no-arg constructor
    }

    /**
     * Creates an active source fetched with the plain adapter.
     *
     * @param url  the listing page URL (must be unique)
     * @param name a human-readable label, also used as the organization fallback
     */
    public Source(String url, String name) {
        this.url = url;
        this.name = name;
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

    public UUID getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public AdapterType getAdapterType() {
        return adapterType;
    }

    public void setAdapterType(AdapterType adapterType) {
        this.adapterType = adapterType;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getWaitSelector() {
        return waitSelector;
    }

    public void setWaitSelector(String waitSelector) {
        this.waitSelector = waitSelector;
    }

    public String getDetailUrlTemplate() {
        return detailUrlTemplate;
    }

    public void setDetailUrlTemplate(String detailUrlTemplate) {
        this.detailUrlTemplate = detailUrlTemplate;
    }

    public Instant getLastCrawledAt() {
        return lastCrawledAt;
    }

    public void setLastCrawledAt(Instant lastCrawledAt) {
        this.lastCrawledAt = lastCrawledAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
