package dev.granary.analysis;

import dev.granary.catalog.AnalysisStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Acknowledgement of an accepted reanalysis request.
 *
 * @param attachmentId attachment being reanalyzed
 * @param status status at acceptance, always {@link AnalysisStatus#ANALYZING}
 * @param acceptedAt when the request was queued
 */
public record ReanalysisTicket(UUID attachmentId, AnalysisStatus status, Instant acceptedAt) {}
