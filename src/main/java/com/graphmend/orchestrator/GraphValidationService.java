package com.graphmend.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.graphmend.communication.RepairEventBus;
import com.graphmend.config.EngineSettings;
import com.graphmend.core.GraphErrorCode;
import com.graphmend.core.codec.GraphJsonCodec;
import com.graphmend.core.codec.GraphPayloadException;
import com.graphmend.core.connectivity.ConnectivityAnalyzer;
import com.graphmend.core.connectivity.ConnectivityDiagnostic;
import com.graphmend.core.connectivity.MinimumStructureResult;
import com.graphmend.core.connectivity.MinimumStructureValidator;
import com.graphmend.core.event.RepairEvent;
import com.graphmend.core.event.RepairEventType;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.StructuralMeta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * GraphValidationService — the engine's entry points for collaborators.
 *
 *   validateAndFixGraph             size gate, then the full repair pipeline
 *   checkConnectedMinimumStructure  read-only connectivity diagnostic
 *   checkMinimumStructure           required kinds + connectivity verdict
 *
 * The caller's graph is never mutated: the pipeline runs on a copy.
 */
@Component
public class GraphValidationService {

    private static final Logger log = LoggerFactory.getLogger(GraphValidationService.class);

    private static final String SOURCE = "GraphValidationService";

    private final GraphRepairPipeline       pipeline;
    private final ConnectivityAnalyzer      connectivityAnalyzer;
    private final MinimumStructureValidator minimumStructureValidator;
    private final GraphJsonCodec            codec;
    private final EngineSettings            settings;
    private final RepairEventBus            eventBus;

    public GraphValidationService(
            GraphRepairPipeline       pipeline,
            ConnectivityAnalyzer      connectivityAnalyzer,
            MinimumStructureValidator minimumStructureValidator,
            GraphJsonCodec            codec,
            EngineSettings            settings,
            RepairEventBus            eventBus
    ) {
        this.pipeline                  = pipeline;
        this.connectivityAnalyzer      = connectivityAnalyzer;
        this.minimumStructureValidator = minimumStructureValidator;
        this.codec                     = codec;
        this.settings                  = settings;
        this.eventBus                  = eventBus;
    }

    // =========================================================================
    // validateAndFixGraph
    // =========================================================================

    public ValidationResult validateAndFixGraph(DecisionGraph graph) {
        return validateAndFixGraph(graph, null, ValidationOptions.from(settings));
    }

    public ValidationResult validateAndFixGraph(DecisionGraph graph, StructuralMeta structuralMeta) {
        return validateAndFixGraph(graph, structuralMeta, ValidationOptions.from(settings));
    }

    public ValidationResult validateAndFixGraph(DecisionGraph graph, StructuralMeta structuralMeta,
                                                ValidationOptions options) {
        if (graph == null) {
            return reject(GraphErrorCode.CEE_GRAPH_MALFORMED, "Graph is missing");
        }
        if (options == null) {
            options = ValidationOptions.from(settings);
        }

        if (options.isCheckSizeLimits()) {
            if (graph.nodeCount() > options.getMaxNodes()) {
                return reject(GraphErrorCode.CEE_GRAPH_TOO_LARGE, String.format(
                        "Graph exceeds node limit: %d nodes (max %d)", graph.nodeCount(), options.getMaxNodes()));
            }
            if (graph.edgeCount() > options.getMaxEdges()) {
                return reject(GraphErrorCode.CEE_GRAPH_TOO_LARGE, String.format(
                        "Graph exceeds edge limit: %d edges (max %d)", graph.edgeCount(), options.getMaxEdges()));
            }
        }

        PipelineReport         report    = pipeline.run(graph.copy(), structuralMeta, options);
        MinimumStructureResult structure = minimumStructureValidator.check(report.getGraph());

        if (!structure.isValid()) {
            log.warn("[Validation] Repaired graph still fails minimum structure: {} ({})",
                    structure.getErrorCode(), structure.getReason());
        }
        return ValidationResult.repaired(report, structure);
    }

    /**
     * JSON entry point. Payload problems come back as a CEE_GRAPH_MALFORMED
     * rejection rather than an exception.
     */
    public ValidationResult validateAndFixGraph(JsonNode graphJson, JsonNode structuralMetaJson,
                                                ValidationOptions options) {
        DecisionGraph  graph;
        StructuralMeta meta;
        try {
            graph = codec.fromTree(graphJson);
            meta  = codec.readStructuralMeta(structuralMetaJson);
        } catch (GraphPayloadException e) {
            return reject(GraphErrorCode.CEE_GRAPH_MALFORMED, e.getMessage());
        }
        return validateAndFixGraph(graph, meta, options);
    }

    // =========================================================================
    // Structure checks
    // =========================================================================

    public ConnectivityDiagnostic checkConnectedMinimumStructure(DecisionGraph graph) {
        return connectivityAnalyzer.analyze(graph);
    }

    public MinimumStructureResult checkMinimumStructure(DecisionGraph graph) {
        return minimumStructureValidator.check(graph);
    }

    private ValidationResult reject(GraphErrorCode code, String error) {
        log.warn("[Validation] Rejected graph: {} - {}", code, error);
        eventBus.publish(new RepairEvent(RepairEventType.GRAPH_REJECTED, SOURCE, error));
        return ValidationResult.rejected(code, error);
    }
}
