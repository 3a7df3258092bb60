package io.sessionkeeper.memory;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.model.CampaignTemplate;
import io.sessionkeeper.storage.KeyValueStore;
import io.sessionkeeper.util.Hashing;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent catalog of approved campaign templates and the similarity search over them.
 *
 * <p>One catalog serves every session of a storage root. Templates are immutable: saving a
 * template whose id already exists returns the existing id without rewriting it.
 *
 * <p>Similarity is a weighted sum in {@code [0, 1]}:
 * <ul>
 *   <li>0.4 when the category matches (case-insensitive);</li>
 *   <li>0.4 x |A &cap; B| / max(|A|, |B|) over the keyword sets;</li>
 *   <li>0.2 x the same ratio over lower-cased, whitespace-split audience words.</li>
 * </ul>
 */
public final class CampaignCatalog {
    private static final Logger log = LoggerFactory.getLogger(CampaignCatalog.class);
    public static final String INDEX_NAME = "templates_index";
    public static final double SUGGESTION_QUALITY_FLOOR = 85.0;
    public static final int SUGGESTION_LIMIT = 3;
    public static final int DEFAULT_LIMIT = 5;
    static final double CATEGORY_WEIGHT = 0.4;
    static final double KEYWORD_WEIGHT = 0.4;
    static final double AUDIENCE_WEIGHT = 0.2;

    private final KeyValueStore store;
    private final double approvalThreshold;
    private final Map<String, CampaignTemplate> templates;

    public CampaignCatalog(KeyValueStore store, double approvalThreshold) {
        this.store = store;
        this.approvalThreshold = approvalThreshold;
        this.templates = new ConcurrentHashMap<>();
        loadTemplates();
    }

    public static CampaignCatalog open(SessionKeeperConfig config) {
        KeyValueStore store = new KeyValueStore(config.templatesDir(), INDEX_NAME, templateId -> templateId);
        return new CampaignCatalog(store, config.approvalThreshold());
    }

    public static String templateId(String label, String category, String sessionId) {
        return Hashing.md5Hex(label + ":" + category + ":" + sessionId).substring(0, 16);
    }

    /**
     * Persists an approved run.
     *
     * @return the template id, or empty when the score is under the approval threshold or the
     *         write failed
     */
    public Optional<String> save(String sessionId, Draft draft) {
        if (draft == null || Double.isNaN(draft.qualityScore()) || draft.qualityScore() < approvalThreshold) {
            log.debug("Template for session {} not saved: quality {} below threshold {}",
                    sessionId, draft == null ? null : draft.qualityScore(), approvalThreshold);
            return Optional.empty();
        }
        String templateId = templateId(draft.label(), draft.category(), sessionId);
        if (templates.containsKey(templateId)) {
            return Optional.of(templateId);
        }
        try {
            CampaignTemplate template = new CampaignTemplate(
                    templateId,
                    draft.label(),
                    draft.category(),
                    draft.qualityScore(),
                    Instant.now(),
                    sessionId,
                    draft.audienceDescriptor(),
                    draft.keywords(),
                    draft.structuralPayload() == null ? Jsons.mapper().createObjectNode() : draft.structuralPayload(),
                    draft.resultMetrics() == null ? Jsons.mapper().createObjectNode() : draft.resultMetrics(),
                    draft.tags()
            );
            if (store.putIfAbsent(templateId, Jsons.mapper().valueToTree(template))) {
                templates.put(templateId, template);
            } else {
                reloadTemplate(templateId);
            }
            return Optional.of(templateId);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to save campaign template {} for session {}", templateId, sessionId, e);
            return Optional.empty();
        }
    }

    public List<Match> findSimilar(Query query) {
        List<Match> matches = new ArrayList<>();
        for (CampaignTemplate template : templates.values()) {
            if (template.qualityScore() < query.minQualityScore()) {
                continue;
            }
            double score = similarity(template, query);
            if (score > 0.0) {
                matches.add(new Match(template, score));
            }
        }
        matches.sort(Comparator.comparingDouble(Match::similarityScore)
                .thenComparingDouble(m -> m.template().qualityScore())
                .reversed());
        return matches.size() > query.limit() ? List.copyOf(matches.subList(0, query.limit())) : List.copyOf(matches);
    }

    public Optional<Suggestion> suggest(ProductDescriptor product) {
        List<Match> matches = findSimilar(new Query(
                product.category(),
                product.keywords(),
                product.audience(),
                SUGGESTION_QUALITY_FLOOR,
                SUGGESTION_LIMIT
        ));
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        Match best = matches.get(0);
        CampaignTemplate template = best.template();
        List<String> keywords = template.keywords().size() > 10 ? template.keywords().subList(0, 10) : template.keywords();
        return Optional.of(new Suggestion(
                template.templateId(),
                best.similarityScore(),
                template.label(),
                template.qualityScore(),
                template.createdAt(),
                List.copyOf(keywords),
                template.structuralPayload(),
                template.resultMetrics(),
                String.format(Locale.ROOT,
                        "Found similar campaign for '%s' with %.1f%% quality score. Consider using this template as reference.",
                        template.label(), template.qualityScore())
        ));
    }

    public Optional<CampaignTemplate> get(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    public int size() {
        return templates.size();
    }

    static double similarity(CampaignTemplate template, Query query) {
        double score = 0.0;
        if (query.category() != null && !query.category().isBlank() && template.category() != null
                && template.category().trim().equalsIgnoreCase(query.category().trim())) {
            score += CATEGORY_WEIGHT;
        }
        score += KEYWORD_WEIGHT * overlapRatio(normalize(query.keywords()), normalize(template.keywords()));
        score += AUDIENCE_WEIGHT * overlapRatio(words(query.audience()), words(template.audienceDescriptor()));
        return score;
    }

    static double overlapRatio(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String value : a) {
            if (b.contains(value)) {
                common++;
            }
        }
        return (double) common / Math.max(a.size(), b.size());
    }

    private static Set<String> normalize(Collection<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values == null) {
            return out;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    private static Set<String> words(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String word : text.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!word.isEmpty()) {
                out.add(word);
            }
        }
        return out;
    }

    private void loadTemplates() {
        for (String templateId : store.keys()) {
            reloadTemplate(templateId);
        }
    }

    private void reloadTemplate(String templateId) {
        try {
            Optional<JsonNode> node = store.get(templateId);
            if (node.isPresent()) {
                templates.put(templateId, Jsons.mapper().treeToValue(node.get(), CampaignTemplate.class));
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping unreadable campaign template {}: {}", templateId, e.getMessage());
        }
    }

    /**
     * Input for {@link #save}; the id, timestamp and session are assigned by the catalog.
     */
    public record Draft(
            String label,
            String category,
            double qualityScore,
            String audienceDescriptor,
            List<String> keywords,
            JsonNode structuralPayload,
            JsonNode resultMetrics,
            List<String> tags
    ) {
    }

    public record Query(
            String category,
            List<String> keywords,
            String audience,
            double minQualityScore,
            int limit
    ) {
        public Query {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            limit = limit <= 0 ? DEFAULT_LIMIT : limit;
        }

        public static Query byCategory(String category, double minQualityScore) {
            return new Query(category, List.of(), null, minQualityScore, DEFAULT_LIMIT);
        }
    }

    public record Match(CampaignTemplate template, double similarityScore) {
    }

    public record ProductDescriptor(String category, List<String> keywords, String audience) {
    }

    public record Suggestion(
            String templateId,
            double similarityScore,
            String referenceLabel,
            double referenceQualityScore,
            Instant referenceCreatedAt,
            List<String> suggestedKeywords,
            JsonNode suggestedStructure,
            JsonNode resultMetrics,
            String message
    ) {
    }
}
