package com.graphmend.core.cycle;

import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.StructuralMeta;
import com.graphmend.core.warning.StructuralWarning;
import com.graphmend.core.warning.StructuralWarningType;
import com.graphmend.core.warning.WarningSeverity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * CycleHandler — classifies cycles as structural warnings.
 *
 * Breaking cycles belongs to the external DAG stabiliser that runs before the
 * engine. This class only trusts (or, when absent, derives) the cycle metadata
 * and reports it; the graph is never modified here.
 */
@Component
public class CycleHandler {

    private static final Logger log = LoggerFactory.getLogger(CycleHandler.class);

    private final CycleDetector cycleDetector;

    public CycleHandler(CycleDetector cycleDetector) {
        this.cycleDetector = cycleDetector;
    }

    /**
     * Supplied metadata wins, even if it contradicts the graph. Without it,
     * cycles are detected locally.
     */
    public StructuralMeta resolve(DecisionGraph graph, StructuralMeta supplied) {
        if (supplied != null) {
            return supplied;
        }
        StructuralMeta detected = cycleDetector.detect(graph);
        if (detected.hadCycles()) {
            log.warn("[CycleHandler] Input is not a DAG: {} node(s) on cycles — expected upstream stabilisation",
                    detected.getCycleNodeIds().size());
        }
        return detected;
    }

    public Optional<StructuralWarning> classify(StructuralMeta meta) {
        if (meta == null || !meta.hadCycles()) {
            return Optional.empty();
        }
        List<String> nodeIds = new ArrayList<>(new LinkedHashSet<>(meta.getCycleNodeIds()));
        return Optional.of(new StructuralWarning(
                StructuralWarningType.CYCLE_DETECTED,
                WarningSeverity.HIGH,
                nodeIds,
                List.of(),
                "Graph contained cycles; causal analysis assumes a DAG"
        ));
    }
}
