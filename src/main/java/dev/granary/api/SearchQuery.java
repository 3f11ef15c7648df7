package dev.granary.api;

import dev.granary.search.HybridSearchRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/search}; absent scoring parameters take the configured defaults.
 */
public record SearchQuery(
    @NotBlank String queryText,
    @Nullable String sourceType,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double matchThreshold,
    @Nullable @Min(1) @Max(HybridSearchRequest.MAX_MATCH_COUNT) Integer matchCount,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double semanticWeight) {}
