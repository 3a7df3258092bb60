package io.sessionkeeper.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of an approved past run, reused as a starting point for similar products.
 */
public record CampaignTemplate(
        String templateId,
        String label,
        String category,
        double qualityScore,
        Instant createdAt,
        String sessionId,
        String audienceDescriptor,
        List<String> keywords,
        JsonNode structuralPayload,
        JsonNode resultMetrics,
        List<String> tags
) {
    public CampaignTemplate {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
