package dev.granary.api;

import dev.granary.catalog.GroupReviewStatus;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Body of {@code PATCH /api/groups/{id}}; absent fields are left unchanged. */
public record GroupReviewRequest(
    @Nullable GroupReviewStatus reviewStatus, @Nullable UUID canonicalAnnouncementId) {}
