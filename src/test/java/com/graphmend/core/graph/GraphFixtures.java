package com.graphmend.core.graph;

/**
 * Small graph builders shared by the engine tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static GraphNode node(String id, NodeKind kind) {
        return new GraphNode(id, kind, id);
    }

    public static GraphNode goal(String id, String label) {
        return new GraphNode(id, NodeKind.GOAL, label);
    }

    public static GraphNode factor(String id, FactorCategory category) {
        return GraphNode.factor(id, id, category);
    }

    public static GraphEdge edge(String from, String to) {
        return GraphEdge.of(from, to);
    }

    public static DecisionGraph graph(GraphNode... nodes) {
        DecisionGraph graph = new DecisionGraph();
        for (GraphNode node : nodes) {
            graph.addNode(node);
        }
        return graph;
    }

    /**
     * dec1 → {opt1, opt2} → fac1 → {out1, risk1} → goal1, every edge
     * carrying the parameters the engine would give it.
     */
    public static DecisionGraph connectedChain() {
        DecisionGraph graph = graph(
                node("dec1", NodeKind.DECISION),
                node("opt1", NodeKind.OPTION),
                node("opt2", NodeKind.OPTION),
                factor("fac1", FactorCategory.CONTROLLABLE),
                node("out1", NodeKind.OUTCOME),
                node("risk1", NodeKind.RISK),
                goal("goal1", "Grow revenue"));

        graph.addEdge(edge("dec1", "opt1").withBelief(0.5));
        graph.addEdge(edge("dec1", "opt2").withBelief(0.5));
        graph.addEdge(canonical("opt1", "fac1"));
        graph.addEdge(canonical("opt2", "fac1"));
        graph.addEdge(edge("fac1", "out1").withStrengthMean(0.5).withStrengthStd(0.2)
                .withBeliefExists(0.75).withEffectDirection(EffectDirection.POSITIVE));
        graph.addEdge(edge("fac1", "risk1").withStrengthMean(0.3).withStrengthStd(0.2)
                .withBeliefExists(0.75).withEffectDirection(EffectDirection.POSITIVE));
        graph.addEdge(edge("out1", "goal1").withStrengthMean(0.7).withStrengthStd(0.15)
                .withBeliefExists(0.9).withEffectDirection(EffectDirection.POSITIVE));
        graph.addEdge(edge("risk1", "goal1").withStrengthMean(-0.5).withStrengthStd(0.15)
                .withBeliefExists(0.9).withEffectDirection(EffectDirection.NEGATIVE));
        return graph;
    }

    public static GraphEdge canonical(String option, String factor) {
        return edge(option, factor)
                .withStrengthMean(1.0)
                .withStrengthStd(0.01)
                .withBeliefExists(1.0)
                .withEffectDirection(EffectDirection.POSITIVE);
    }
}
