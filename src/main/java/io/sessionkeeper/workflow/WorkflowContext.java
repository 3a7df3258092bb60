package io.sessionkeeper.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionkeeper.config.SessionKeeperConfig;
import io.sessionkeeper.storage.KeyValueStore;
import io.sessionkeeper.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Hand-off of agent outputs inside one workflow run.
 *
 * <p>Each agent's latest output is kept in memory and written to
 * {@code agent_outputs/<agent>.json} in the session namespace, so a reattached session sees the
 * outputs of agents that ran before the restart. Propagation rules copy selected fields of one
 * agent's output into the context built for downstream agents.
 */
public final class WorkflowContext {
    private static final Logger log = LoggerFactory.getLogger(WorkflowContext.class);
    public static final String EXPORT_FILE = "workflow_context.json";

    private final String workflowId;
    private final Path agentOutputsDir;
    private final Path resultsDir;
    private final StateTracker tracker;
    private final LinkedHashMap<String, AgentOutput> outputs = new LinkedHashMap<>();
    private final List<PropagationRule> rules = new ArrayList<>();
    private final Instant startedAt;
    private JsonNode input = Jsons.mapper().createObjectNode();

    public WorkflowContext(String workflowId, Path agentOutputsDir, Path resultsDir, StateTracker tracker) {
        this.workflowId = workflowId;
        this.agentOutputsDir = agentOutputsDir;
        this.resultsDir = resultsDir;
        this.tracker = tracker;
        this.startedAt = Instant.now();
        loadOutputs();
    }

    public String workflowId() {
        return workflowId;
    }

    /**
     * Sets the workflow input. {@code productInfo} and {@code campaignParams} are handed to every
     * agent context.
     */
    public synchronized void initialize(Object inputData) {
        JsonNode tree = inputData == null ? null : Jsons.mapper().valueToTree(inputData);
        input = tree == null || !tree.isObject() ? Jsons.mapper().createObjectNode() : tree;
    }

    public synchronized void addPropagationRule(String fromAgent, Collection<String> toAgents, Collection<String> fields) {
        rules.add(new PropagationRule(fromAgent, List.copyOf(toAgents), List.copyOf(fields)));
    }

    /**
     * Records an agent's output, replacing any earlier one.
     *
     * @return false when the output is not representable as JSON or cannot be written
     */
    public boolean storeAgentOutput(String agentId, String agentName, Object output) {
        if (agentId == null || agentId.isBlank()) {
            return false;
        }
        try {
            JsonNode tree = output == null ? Jsons.mapper().nullNode() : Jsons.mapper().valueToTree(output);
            AgentOutput record = new AgentOutput(agentId, agentName == null ? agentId : agentName, tree, Instant.now());
            Files.createDirectories(agentOutputsDir);
            KeyValueStore.writeAtomically(outputFile(agentId), Jsons.toJson(record));
            synchronized (this) {
                outputs.put(agentId, record);
            }
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to store output of agent {} for workflow {}", agentId, workflowId, e);
            return false;
        }
    }

    public synchronized Optional<JsonNode> getAgentOutput(String agentId) {
        AgentOutput record = outputs.get(agentId);
        return record == null ? Optional.empty() : Optional.of(record.output().deepCopy());
    }

    public synchronized List<AgentOutput> listAgentOutputs() {
        return List.copyOf(outputs.values());
    }

    /**
     * Copies the named fields of {@code fromAgent}'s object output into each target's output,
     * creating an empty output for targets that have none yet.
     */
    public void propagate(String fromAgent, Collection<String> toAgents, Collection<String> fields) {
        Optional<JsonNode> source = getAgentOutput(fromAgent);
        if (source.isEmpty() || !source.get().isObject()) {
            return;
        }
        for (String target : toAgents) {
            ObjectNode merged;
            String name;
            synchronized (this) {
                AgentOutput existing = outputs.get(target);
                merged = existing != null && existing.output().isObject()
                        ? (ObjectNode) existing.output().deepCopy()
                        : Jsons.mapper().createObjectNode();
                name = existing == null ? target : existing.agentName();
            }
            for (String field : fields) {
                if (source.get().has(field)) {
                    merged.set(field, source.get().get(field).deepCopy());
                }
            }
            storeAgentOutput(target, name, merged);
        }
    }

    /**
     * Combines the outputs of agents that ran side by side. Object outputs are merged field by
     * field in the given order, later agents winning; any other non-empty output is placed under
     * its agent id.
     */
    public synchronized ObjectNode mergeParallelOutputs(List<String> agentIds) {
        ObjectNode merged = Jsons.mapper().createObjectNode();
        for (String agentId : agentIds) {
            AgentOutput record = outputs.get(agentId);
            if (record == null || isEmpty(record.output())) {
                continue;
            }
            if (record.output().isObject()) {
                merged.setAll((ObjectNode) record.output().deepCopy());
            } else {
                merged.set(agentId, record.output().deepCopy());
            }
        }
        return merged;
    }

    /**
     * Context handed to one agent: workflow input, current stage, fields propagated to it by
     * rule, and every earlier agent output.
     */
    public synchronized ObjectNode buildAgentContext(String agentId, String agentName) {
        ObjectNode context = Jsons.mapper().createObjectNode();
        context.put("workflowId", workflowId);
        context.put("agentId", agentId);
        context.put("agentName", agentName);
        context.set("productInfo", objectOrEmpty(input.get("productInfo")));
        context.set("campaignParams", objectOrEmpty(input.get("campaignParams")));
        Optional<StateTracker.Stage> stage = tracker.currentStage();
        if (stage.isPresent()) {
            context.set("currentStage", Jsons.mapper().valueToTree(stage.get()));
        } else {
            context.putNull("currentStage");
        }
        String normalizedName = agentName == null ? null : agentName.toLowerCase(Locale.ROOT).replace(' ', '_');
        for (PropagationRule rule : rules) {
            if (!rule.to().contains(agentId) && (normalizedName == null || !rule.to().contains(normalizedName))) {
                continue;
            }
            AgentOutput source = outputs.get(rule.from());
            if (source == null || !source.output().isObject()) {
                continue;
            }
            for (String field : rule.fields()) {
                if (source.output().has(field)) {
                    context.set(field, source.output().get(field).deepCopy());
                }
            }
        }
        ObjectNode previous = context.putObject("previousOutputs");
        outputs.forEach((id, record) -> previous.set(id, Jsons.mapper().valueToTree(record)));
        return context;
    }

    public synchronized ContextSummary summary() {
        return new ContextSummary(
                workflowId,
                startedAt,
                tracker.currentStage().orElse(null),
                outputs.size(),
                input.path("productInfo").path("productName").asText("N/A")
        );
    }

    public Path exportContext() {
        Path file = resultsDir.resolve(EXPORT_FILE);
        exportContext(file);
        return file;
    }

    public void exportContext(Path file) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        synchronized (this) {
            snapshot.put("workflowId", workflowId);
            snapshot.put("startedAt", startedAt);
            snapshot.put("input", input);
            snapshot.put("currentStage", tracker.currentStage().orElse(null));
            snapshot.put("agentOutputs", new LinkedHashMap<>(outputs));
        }
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, Jsons.toJson(snapshot));
        } catch (IOException e) {
            throw new RuntimeException("Failed to export workflow context: " + file, e);
        }
    }

    private Path outputFile(String agentId) {
        return agentOutputsDir.resolve(SessionKeeperConfig.safeSegment(agentId) + ".json");
    }

    private void loadOutputs() {
        if (!Files.isDirectory(agentOutputsDir)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> list = Files.list(agentOutputsDir)) {
            files = list.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            log.warn("Could not list agent outputs in {}", agentOutputsDir, e);
            return;
        }
        for (Path file : files) {
            try {
                AgentOutput record = Jsons.mapper().readValue(file.toFile(), AgentOutput.class);
                if (record != null && record.agentId() != null) {
                    outputs.put(record.agentId(), record);
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable agent output {}: {}", file, e.getMessage());
            }
        }
    }

    private static boolean isEmpty(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode()
                || (node.isContainerNode() && node.size() == 0)
                || (node.isTextual() && node.asText().isEmpty());
    }

    private static JsonNode objectOrEmpty(JsonNode node) {
        return node != null && node.isObject() ? node.deepCopy() : Jsons.mapper().createObjectNode();
    }

    public record AgentOutput(String agentId, String agentName, JsonNode output, Instant timestamp) {
    }

    public record PropagationRule(String from, List<String> to, List<String> fields) {
    }

    public record ContextSummary(
            String workflowId,
            Instant startedAt,
            StateTracker.Stage currentStage,
            int agentsCompleted,
            String productName
    ) {
    }
}
