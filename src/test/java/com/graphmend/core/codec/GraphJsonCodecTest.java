package com.graphmend.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.EffectDirection;
import com.graphmend.core.graph.FactorCategory;
import com.graphmend.core.graph.GraphEdge;
import com.graphmend.core.graph.GraphNode;
import com.graphmend.core.graph.NodeKind;
import com.graphmend.core.graph.StructuralMeta;
import com.graphmend.core.graph.UniformPrior;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphJsonCodecTest {

    private final GraphJsonCodec codec = new GraphJsonCodec();

    @Test
    void testReadsWireFormat() throws Exception {
        String json = """
            {
              "version": "1.2",
              "default_seed": 42,
              "nodes": [
                {"id": "dec1", "kind": "decision", "label": "Pricing"},
                {"id": "fac1", "kind": "factor", "category": "controllable",
                 "data": {"value": 0.4, "factor_type": "price"}},
                {"id": "goal1", "kind": "GOAL"}
              ],
              "edges": [
                {"from": "dec1", "to": "fac1", "strength": {"mean": 0.6, "std": 0.1},
                 "belief_exists": 0.8, "effect_direction": "negative",
                 "provenance": {"source": "doc", "quote": "prices matter"}},
                {"from": "fac1", "to": "goal1", "strength_mean": 0.3, "belief": 0.5}
              ],
              "meta": {"source": "assistant", "roots": ["dec1"]}
            }
            """;

        DecisionGraph graph = codec.read(json);

        assertEquals("1.2", graph.getVersion());
        assertEquals(42L, graph.getDefaultSeed());
        assertEquals(3, graph.nodeCount());
        assertEquals(NodeKind.GOAL, graph.kindOf("goal1"));

        GraphNode factor = graph.getNode("fac1");
        assertEquals(FactorCategory.CONTROLLABLE, factor.getCategory());
        assertEquals(0.4, factor.getDataField(GraphNode.DATA_VALUE));

        GraphEdge nested = graph.getEdges().get(0);
        assertEquals(0.6, nested.getStrengthMean());
        assertEquals(0.1, nested.getStrengthStd());
        assertEquals(0.8, nested.getBeliefExists());
        assertEquals(EffectDirection.NEGATIVE, nested.getEffectDirection());
        assertEquals("prices matter", nested.getProvenance().getQuote());

        GraphEdge flat = graph.getEdges().get(1);
        assertEquals(0.3, flat.getStrengthMean());
        assertNull(flat.getStrengthStd());
        assertEquals(0.5, flat.getBelief());

        assertEquals("assistant", graph.getMeta().getSource());
        assertEquals(List.of("dec1"), graph.getMeta().getRoots());
    }

    @Test
    void testNonFiniteNumbersAreReadForRepair() throws Exception {
        String json = """
            {
              "nodes": [
                {"id": "fac1", "kind": "factor", "data": {"value": NaN}},
                {"id": "out1", "kind": "outcome"}
              ],
              "edges": [
                {"from": "fac1", "to": "out1", "strength_mean": NaN, "strength_std": Infinity}
              ]
            }
            """;

        DecisionGraph graph = codec.read(json);

        GraphEdge edge = graph.getEdges().get(0);
        assertTrue(Double.isNaN(edge.getStrengthMean()));
        assertEquals(Double.POSITIVE_INFINITY, edge.getStrengthStd());
        Number value = (Number) graph.getNode("fac1").getDataField(GraphNode.DATA_VALUE);
        assertTrue(Double.isNaN(value.doubleValue()));
    }

    @Test
    void testMissingHeaderUsesDefaults() throws Exception {
        DecisionGraph graph = codec.read("{\"nodes\": [], \"edges\": []}");

        assertEquals(DecisionGraph.DEFAULT_VERSION, graph.getVersion());
        assertEquals(DecisionGraph.DEFAULT_SEED, graph.getDefaultSeed());
    }

    @Test
    void testMalformedPayloadsAreRejected() {
        assertThrows(GraphPayloadException.class, () -> codec.read("not json"));
        assertThrows(GraphPayloadException.class, () -> codec.read("[]"));
        assertThrows(GraphPayloadException.class, () -> codec.read("{\"nodes\": {}}"));
        assertThrows(GraphPayloadException.class, () -> codec.read("{\"nodes\": [{\"kind\": \"goal\"}]}"));
        assertThrows(GraphPayloadException.class,
                () -> codec.read("{\"nodes\": [{\"id\": \"x\", \"kind\": \"wizard\"}]}"));
        assertThrows(GraphPayloadException.class,
                () -> codec.read("{\"nodes\": [{\"id\": \"x\", \"kind\": \"goal\"}, {\"id\": \"x\", \"kind\": \"option\"}]}"));
        assertThrows(GraphPayloadException.class,
                () -> codec.read("{\"edges\": [{\"from\": \"a\", \"to\": \"b\", \"belief\": \"high\"}]}"));
    }

    @Test
    void testWriteOmitsAbsentFields() throws Exception {
        DecisionGraph graph = new DecisionGraph();
        graph.addNode(new GraphNode("opt1", NodeKind.OPTION));
        GraphNode factor = GraphNode.factor("fac1", "Demand", FactorCategory.EXTERNAL);
        factor.setPrior(new UniformPrior(0.2, 0.6));
        graph.addNode(factor);
        graph.addEdge(GraphEdge.of("opt1", "fac1").withStrengthMean(1.0).withId("opt1::fac1::0"));

        ObjectNode tree = codec.toTree(graph);

        JsonNode option = tree.get("nodes").get(0);
        assertFalse(option.has("label"));
        assertFalse(option.has("category"));
        assertFalse(option.has("data"));

        JsonNode prior = tree.get("nodes").get(1).get("prior");
        assertEquals("uniform", prior.get("distribution").asText());
        assertEquals(0.2, prior.get("range_min").asDouble());

        JsonNode edge = tree.get("edges").get(0);
        assertEquals(1.0, edge.get("strength_mean").asDouble());
        assertFalse(edge.has("strength_std"));
        assertFalse(edge.has("belief"));
        assertFalse(edge.has("provenance"));
    }

    @Test
    void testWrittenGraphReadsBack() throws Exception {
        DecisionGraph graph = new DecisionGraph();
        graph.addNode(new GraphNode("dec1", NodeKind.DECISION, "Pricing"));
        graph.addNode(new GraphNode("opt1", NodeKind.OPTION, "Raise"));
        graph.addEdge(GraphEdge.of("dec1", "opt1").withBelief(1.0));

        DecisionGraph back = codec.read(codec.write(graph));

        assertEquals("Raise", back.getNode("opt1").getLabel());
        assertEquals(1.0, back.getEdges().get(0).getBelief());
    }

    @Test
    void testStructuralMeta() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        StructuralMeta meta = codec.readStructuralMeta(
                mapper.readTree("{\"had_cycles\": true, \"cycle_node_ids\": [\"a\", \"b\", \"a\"]}"));

        assertTrue(meta.hadCycles());
        assertEquals(List.of("a", "b"), meta.getCycleNodeIds());
        assertFalse(codec.readStructuralMeta(null).hadCycles());
    }
}
