package com.graphmend.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphMeta;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.Position;
import com.graphmend.core.graph.Provenance;
import com.graphmend.core.graph.StructuralMeta;
import com.graphmend.core.graph.UniformPrior;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * GraphJsonCodec — reads and writes decision graphs in the snake_case wire
 * format using the Jackson tree model.
 *
 * Reading is the one place where payload types are checked; everything
 * downstream works on {@link DecisionGraph}. Edge strength is accepted flat
 * (strength_mean / strength_std) or nested (strength: {mean, std}) and
 * always written flat. Absent and null fields are not written.
 */
@Component
public class GraphJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(GraphJsonCodec.class);

    // NaN / Infinity are let through so the numeric sanitiser can repair them
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() {};

    // =========================================================================
    // Read
    // =========================================================================

    public DecisionGraph read(String json) throws GraphPayloadException {
        if (json == null || json.isBlank()) {
            throw new GraphPayloadException("Graph payload is empty");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GraphPayloadException("Graph payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    public DecisionGraph fromTree(JsonNode root) throws GraphPayloadException {
        if (root == null || !root.isObject()) {
            throw new GraphPayloadException("Graph payload must be a JSON object");
        }

        String version = root.hasNonNull("version") ? root.get("version").asText() : DecisionGraph.DEFAULT_VERSION;
        long   seed    = DecisionGraph.DEFAULT_SEED;
        if (root.hasNonNull("default_seed")) {
            JsonNode seedNode = root.get("default_seed");
            if (!seedNode.canConvertToLong()) {
                throw new GraphPayloadException("default_seed must be an integer");
            }
            seed = seedNode.asLong();
        }

        DecisionGraph graph = new DecisionGraph(version, seed, readMeta(root.get("meta")));

        for (JsonNode nodeJson : arrayField(root, "nodes")) {
            GraphNode node = readNode(nodeJson);
            if (graph.hasNode(node.getId())) {
                throw new GraphPayloadException("Duplicate node id: " + node.getId());
            }
            graph.addNode(node);
        }
        for (JsonNode edgeJson : arrayField(root, "edges")) {
            graph.addEdge(readEdge(edgeJson));
        }

        log.debug("[Codec] Read graph with {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /** Reads {had_cycles, cycle_node_ids}; null or missing input gives {@link StructuralMeta#none()}. */
    public StructuralMeta readStructuralMeta(JsonNode json) throws GraphPayloadException {
        if (json == null || json.isNull()) {
            return StructuralMeta.none();
        }
        if (!json.isObject()) {
            throw new GraphPayloadException("structural meta must be an object");
        }
        boolean      hadCycles = json.path("had_cycles").asBoolean(false);
        List<String> ids       = stringList(json.get("cycle_node_ids"), "cycle_node_ids");
        return new StructuralMeta(hadCycles, ids);
    }

    private GraphNode readNode(JsonNode json) throws GraphPayloadException {
        if (!json.isObject()) {
            throw new GraphPayloadException("Node entries must be objects");
        }
        String id = requiredText(json, "id", "node");
        String kindText = requiredText(json, "kind", "node " + id);
        NodeKind kind = NodeKind.fromWire(kindText);
        if (kind == null) {
            throw new GraphPayloadException("Unknown node kind '" + kindText + "' on node " + id);
        }

        GraphNode node = new GraphNode(id, kind, optionalText(json, "label"));
        node.setBody(optionalText(json, "body"));

        String categoryText = optionalText(json, "category");
        if (categoryText != null) {
            FactorCategory category = FactorCategory.fromWire(categoryText);
            if (category == null) {
                throw new GraphPayloadException("Unknown factor category '" + categoryText + "' on node " + id);
            }
            if (kind == NodeKind.FACTOR) {
                node.setCategory(category);
            } else {
                log.debug("[Codec] Ignoring category on non-factor node '{}'", id);
            }
        }

        JsonNode data = json.get("data");
        if (data != null && !data.isNull()) {
            if (!data.isObject()) {
                throw new GraphPayloadException("data must be an object on node " + id);
            }
            node.setData(MAPPER.convertValue(data, DATA_TYPE));
        }

        JsonNode prior = json.get("prior");
        if (prior != null && prior.isObject() && kind == NodeKind.FACTOR) {
            try {
                node.setPrior(new UniformPrior(
                        number(prior, "range_min", "prior of " + id),
                        number(prior, "range_max", "prior of " + id)));
            } catch (IllegalArgumentException e) {
                throw new GraphPayloadException(e.getMessage() + " on node " + id, e);
            }
        }
        return node;
    }

    private GraphEdge readEdge(JsonNode json) throws GraphPayloadException {
        if (!json.isObject()) {
            throw new GraphPayloadException("Edge entries must be objects");
        }
        String from = requiredText(json, "from", "edge");
        String to   = requiredText(json, "to", "edge " + from + "→?");
        String ref  = "edge " + from + "→" + to;

        GraphEdge edge = GraphEdge.of(from, to)
                .withId(optionalText(json, "id"))
                .withBeliefExists(optionalNumber(json, "belief_exists", ref))
                .withBelief(optionalNumber(json, "belief", ref))
                .withWeight(optionalNumber(json, "weight", ref))
                .withOrigin(optionalText(json, "origin"));

        JsonNode strength = json.get("strength");
        if (strength != null && strength.isObject()) {
            edge.setStrengthMean(optionalNumber(strength, "mean", ref));
            edge.setStrengthStd(optionalNumber(strength, "std", ref));
        }
        if (json.hasNonNull("strength_mean")) {
            edge.setStrengthMean(optionalNumber(json, "strength_mean", ref));
        }
        if (json.hasNonNull("strength_std")) {
            edge.setStrengthStd(optionalNumber(json, "strength_std", ref));
        }

        String direction = optionalText(json, "effect_direction");
        if (direction != null) {
            EffectDirection parsed = EffectDirection.fromWire(direction);
            if (parsed == null) {
                throw new GraphPayloadException("Unknown effect_direction '" + direction + "' on " + ref);
            }
            edge.setEffectDirection(parsed);
        }

        JsonNode provenance = json.get("provenance");
        if (provenance != null && !provenance.isNull()) {
            if (provenance.isTextual()) {
                edge.setProvenance(new Provenance(null, provenance.asText()));
            } else if (provenance.isObject()) {
                edge.setProvenance(new Provenance(optionalText(provenance, "source"), optionalText(provenance, "quote")));
            } else {
                throw new GraphPayloadException("provenance must be an object or string on " + ref);
            }
        }
        return edge;
    }

    private GraphMeta readMeta(JsonNode json) throws GraphPayloadException {
        GraphMeta meta = new GraphMeta();
        if (json == null || json.isNull()) {
            return meta;
        }
        if (!json.isObject()) {
            throw new GraphPayloadException("meta must be an object");
        }
        meta.setSource(optionalText(json, "source"));
        meta.setRoots(stringList(json.get("roots"), "meta.roots"));
        meta.setLeaves(stringList(json.get("leaves"), "meta.leaves"));

        JsonNode positions = json.get("suggested_positions");
        if (positions != null && positions.isObject()) {
            Map<String, Position> parsed = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = positions.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String ref = "suggested_positions." + entry.getKey();
                parsed.put(entry.getKey(), new Position(
                        number(entry.getValue(), "x", ref),
                        number(entry.getValue(), "y", ref)));
            }
            meta.setSuggestedPositions(parsed);
        }
        return meta;
    }

    // =========================================================================
    // Write
    // =========================================================================

    public String write(DecisionGraph graph) {
        try {
            return MAPPER.writeValueAsString(toTree(graph));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise graph", e);
        }
    }

    public ObjectNode toTree(DecisionGraph graph) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", graph.getVersion());
        root.put("default_seed", graph.getDefaultSeed());

        ArrayNode nodes = root.putArray("nodes");
        for (GraphNode node : graph.getNodes()) {
            nodes.add(writeNode(node));
        }
        ArrayNode edges = root.putArray("edges");
        for (GraphEdge edge : graph.getEdges()) {
            edges.add(writeEdge(edge));
        }
        root.set("meta", writeMeta(graph.getMeta()));
        return root;
    }

    private ObjectNode writeNode(GraphNode node) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("id", node.getId());
        json.put("kind", node.getKind().wireName());
        putIfPresent(json, "label", node.getLabel());
        if (node.getCategory() != null) {
            json.put("category", node.getCategory().wireName());
        }
        if (node.hasData()) {
            ObjectNode data = MAPPER.valueToTree(node.getData());
            data.remove(nullFields(data));
            json.set("data", data);
        }
        putIfPresent(json, "body", node.getBody());
        if (node.getPrior() != null) {
            ObjectNode prior = json.putObject("prior");
            prior.put("distribution", node.getPrior().getDistribution());
            prior.put("range_min", node.getPrior().getRangeMin());
            prior.put("range_max", node.getPrior().getRangeMax());
        }
        return json;
    }

    private ObjectNode writeEdge(GraphEdge edge) {
        ObjectNode json = MAPPER.createObjectNode();
        putIfPresent(json, "id", edge.getId());
        json.put("from", edge.getFrom());
        json.put("to", edge.getTo());
        putIfPresent(json, "strength_mean", edge.getStrengthMean());
        putIfPresent(json, "strength_std", edge.getStrengthStd());
        putIfPresent(json, "belief_exists", edge.getBeliefExists());
        if (edge.getEffectDirection() != null) {
            json.put("effect_direction", edge.getEffectDirection().wireName());
        }
        putIfPresent(json, "belief", edge.getBelief());
        putIfPresent(json, "weight", edge.getWeight());
        if (edge.getProvenance() != null) {
            ObjectNode provenance = json.putObject("provenance");
            putIfPresent(provenance, "source", edge.getProvenance().getSource());
            putIfPresent(provenance, "quote", edge.getProvenance().getQuote());
        }
        putIfPresent(json, "origin", edge.getOrigin());
        return json;
    }

    private ObjectNode writeMeta(GraphMeta meta) {
        ObjectNode json = MAPPER.createObjectNode();
        ArrayNode roots = json.putArray("roots");
        meta.getRoots().forEach(roots::add);
        ArrayNode leaves = json.putArray("leaves");
        meta.getLeaves().forEach(leaves::add);
        ObjectNode positions = json.putObject("suggested_positions");
        for (Map.Entry<String, Position> entry : meta.getSuggestedPositions().entrySet()) {
            ObjectNode point = positions.putObject(entry.getKey());
            point.put("x", entry.getValue().getX());
            point.put("y", entry.getValue().getY());
        }
        putIfPresent(json, "source", meta.getSource());
        return json;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static Iterable<JsonNode> arrayField(JsonNode root, String name) throws GraphPayloadException {
        JsonNode value = root.get(name);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new GraphPayloadException(name + " must be an array");
        }
        return value;
    }

    private static String requiredText(JsonNode json, String field, String owner) throws GraphPayloadException {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new GraphPayloadException("Missing or non-string '" + field + "' on " + owner);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Double optionalNumber(JsonNode json, String field, String owner) throws GraphPayloadException {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new GraphPayloadException("'" + field + "' must be a number on " + owner);
        }
        return value.asDouble();
    }

    private static double number(JsonNode json, String field, String owner) throws GraphPayloadException {
        Double value = optionalNumber(json, field, owner);
        if (value == null) {
            throw new GraphPayloadException("Missing '" + field + "' on " + owner);
        }
        return value;
    }

    private static List<String> stringList(JsonNode json, String owner) throws GraphPayloadException {
        List<String> values = new ArrayList<>();
        if (json == null || json.isNull()) {
            return values;
        }
        if (!json.isArray()) {
            throw new GraphPayloadException(owner + " must be an array");
        }
        // cycle ids can repeat across reported cycles; keep first-seen order
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (JsonNode item : json) {
            unique.add(item.asText());
        }
        values.addAll(unique);
        return values;
    }

    private static List<String> nullFields(ObjectNode json) {
        List<String> names = new ArrayList<>();
        json.fields().forEachRemaining(e -> {
            if (e.getValue().isNull()) {
                names.add(e.getKey());
            }
        });
        return names;
    }

    private static void putIfPresent(ObjectNode json, String field, String value) {
        if (value != null) {
            json.put(field, value);
        }
    }

    private static void putIfPresent(ObjectNode json, String field, Double value) {
        if (value != null) {
            json.put(field, value);
        }
    }
}
