package com.graphmend.orchestrator;

import com.graphmend.communication.RepairEventBus;
import com.graphmend.core.audit.FieldDeletionEvent;
import com.graphmend.core.audit.RepairRecord;
import com.graphmend.core.audit.StageOutcome;
import com.graphmend.core.connectivity.ConnectivityAnalyzer;
import com.graphmend.core.connectivity.ConnectivityDiagnostic;
import com.graphmend.core.cycle.CycleHandler;
import com.graphmend.core.event.RepairEvent;
import com.graphmend.core.event.RepairEventType;
import com.graphmend.core.event.StageSummary;
import com.graphmend.core.finalize.DeterminismFinalizer;
import com.graphmend.core.graph.DecisionGraph;
import com.graphmend.core.graph.StructuralMeta;
import com.graphmend.core.repair.BeliefNormalizer;
import com.graphmend.core.repair.CanonicalEdgeEnforcer;
import com.graphmend.core.repair.DanglingEdgeFilter;
import com.graphmend.core.repair.FactorCategoryReconciler;
import com.graphmend.core.repair.FactorGoalSplitter;
import com.graphmend.core.repair.NumericSanitizer;
import com.graphmend.core.repair.OrphanWiring;
import com.graphmend.core.repair.OutcomeBeliefFiller;
import com.graphmend.core.repair.SignMismatchFixer;
import com.graphmend.core.repair.SingleGoalEnforcer;
import com.graphmend.core.repair.SingleGoalResult;
import com.graphmend.core.repair.UnreachablePruner;
import com.graphmend.core.warning.StructuralWarningDetector;
import com.graphmend.core.warning.StructuralWarningReport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * GraphRepairPipeline — runs every repair stage in a fixed order.
 *
 * Stage flow:
 *   dangling edges → cycle metadata → non-finite numbers → sign mismatches
 *   → single goal → factor→goal split → belief normalisation → outcome beliefs → wire to goal → wire from causal chain → prune
 *   → factor categories → canonical edges → finalise → warnings
 *
 * The pipeline owns the graph it is given and mutates it; the returned report
 * holds the graph to use afterwards (the canonical enforcer may hand back a
 * new instance). Each stage that changed something is published as
 * STAGE_APPLIED, each field deletion as FIELD_DELETED.
 */
@Component
public class GraphRepairPipeline {

    private static final Logger log = LoggerFactory.getLogger(GraphRepairPipeline.class);

    private static final String SOURCE = "GraphRepairPipeline";

    private final DanglingEdgeFilter        danglingEdgeFilter;
    private final CycleHandler              cycleHandler;
    private final NumericSanitizer          numericSanitizer;
    private final SignMismatchFixer         signMismatchFixer;
    private final SingleGoalEnforcer        singleGoalEnforcer;
    private final FactorGoalSplitter        factorGoalSplitter;
    private final BeliefNormalizer          beliefNormalizer;
    private final OutcomeBeliefFiller       outcomeBeliefFiller;
    private final OrphanWiring              orphanWiring;
    private final UnreachablePruner         unreachablePruner;
    private final FactorCategoryReconciler  factorCategoryReconciler;
    private final CanonicalEdgeEnforcer     canonicalEdgeEnforcer;
    private final DeterminismFinalizer      finalizer;
    private final StructuralWarningDetector warningDetector;
    private final ConnectivityAnalyzer      connectivityAnalyzer;
    private final RepairEventBus            eventBus;

    public GraphRepairPipeline(
            DanglingEdgeFilter        danglingEdgeFilter,
            CycleHandler              cycleHandler,
            NumericSanitizer          numericSanitizer,
            SignMismatchFixer         signMismatchFixer,
            SingleGoalEnforcer        singleGoalEnforcer,
            FactorGoalSplitter        factorGoalSplitter,
            BeliefNormalizer          beliefNormalizer,
            OutcomeBeliefFiller       outcomeBeliefFiller,
            OrphanWiring              orphanWiring,
            UnreachablePruner         unreachablePruner,
            FactorCategoryReconciler  factorCategoryReconciler,
            CanonicalEdgeEnforcer     canonicalEdgeEnforcer,
            DeterminismFinalizer      finalizer,
            StructuralWarningDetector warningDetector,
            ConnectivityAnalyzer      connectivityAnalyzer,
            RepairEventBus            eventBus
    ) {
        this.danglingEdgeFilter       = danglingEdgeFilter;
        this.cycleHandler             = cycleHandler;
        this.numericSanitizer         = numericSanitizer;
        this.signMismatchFixer        = signMismatchFixer;
        this.singleGoalEnforcer       = singleGoalEnforcer;
        this.factorGoalSplitter       = factorGoalSplitter;
        this.beliefNormalizer         = beliefNormalizer;
        this.outcomeBeliefFiller      = outcomeBeliefFiller;
        this.orphanWiring             = orphanWiring;
        this.unreachablePruner        = unreachablePruner;
        this.factorCategoryReconciler = factorCategoryReconciler;
        this.canonicalEdgeEnforcer    = canonicalEdgeEnforcer;
        this.finalizer                = finalizer;
        this.warningDetector          = warningDetector;
        this.connectivityAnalyzer     = connectivityAnalyzer;
        this.eventBus                 = eventBus;
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public PipelineReport run(DecisionGraph graph, StructuralMeta supplied, ValidationOptions options) {

        RunState state = new RunState(graph);
        ConnectivityDiagnostic before = connectivityAnalyzer.analyze(graph);

        state.apply(danglingEdgeFilter.apply(state.graph));

        StructuralMeta structuralMeta = cycleHandler.resolve(state.graph, supplied);

        state.apply(numericSanitizer.sanitize(state.graph));
        state.apply(signMismatchFixer.fix(state.graph));

        SingleGoalResult singleGoal = null;
        if (options.isEnforceSingleGoal()) {
            singleGoal = singleGoalEnforcer.enforce(state.graph);
            state.apply(singleGoal.toStageOutcome());
        }

        state.apply(factorGoalSplitter.split(state.graph));

        StageOutcome normalised = state.apply(beliefNormalizer.normalize(state.graph));

        int outcomeBeliefsFilled = 0;
        if (options.isFillOutcomeBeliefs()) {
            outcomeBeliefsFilled = state.apply(
                    outcomeBeliefFiller.fill(state.graph, options.getDefaultOutcomeBelief())).getRepairs().size();
        }

        state.apply(orphanWiring.wireToGoal(state.graph));
        state.apply(orphanWiring.wireFromCausalChain(state.graph));
        state.apply(unreachablePruner.prune(state.graph));
        state.apply(factorCategoryReconciler.reconcile(state.graph));
        state.apply(canonicalEdgeEnforcer.enforce(state.graph));

        DecisionGraph finalGraph = finalizer.finalizeGraph(state.graph);

        StructuralWarningReport warnings = warningDetector.detect(finalGraph, structuralMeta);
        ConnectivityDiagnostic  after    = connectivityAnalyzer.analyze(finalGraph);

        PipelineReport report = PipelineReport.builder()
                .graph(finalGraph)
                .repairs(state.repairs)
                .fieldDeletions(state.fieldDeletions)
                .stagesApplied(state.stagesApplied)
                .warningReport(warnings)
                .structuralMeta(structuralMeta)
                .connectivityBefore(before)
                .connectivityAfter(after)
                .singleGoal(singleGoal)
                .outcomeBeliefsFilled(outcomeBeliefsFilled)
                .decisionBranchesNormalized(normalised.changed())
                .build();

        log.info("[Pipeline] Repaired graph: {}", report);
        eventBus.publish(new RepairEvent(RepairEventType.GRAPH_REPAIRED, SOURCE, report));
        return report;
    }

    private void publishStage(String stage, int repairCount, int mutationCount) {
        eventBus.publish(new RepairEvent(RepairEventType.STAGE_APPLIED, SOURCE,
                new StageSummary(stage, repairCount, mutationCount)));
    }

    // =========================================================================
    // Per-run accumulator
    // =========================================================================

    private final class RunState {

        private DecisionGraph                  graph;
        private final List<RepairRecord>       repairs        = new ArrayList<>();
        private final List<FieldDeletionEvent> fieldDeletions = new ArrayList<>();
        private final List<String>             stagesApplied  = new ArrayList<>();

        private RunState(DecisionGraph graph) {
            this.graph = graph;
        }

        /** Adopt the stage's graph and collect its audit output. */
        private StageOutcome apply(StageOutcome outcome) {
            graph = outcome.getGraph();
            if (!outcome.changed()) {
                return outcome;
            }
            repairs.addAll(outcome.getRepairs());
            fieldDeletions.addAll(outcome.getFieldDeletions());
            stagesApplied.add(outcome.getStage());

            publishStage(outcome.getStage(), outcome.getRepairs().size(), outcome.getMutationCount());
            for (FieldDeletionEvent deletion : outcome.getFieldDeletions()) {
                eventBus.publish(new RepairEvent(RepairEventType.FIELD_DELETED, outcome.getStage(), deletion));
            }
            return outcome;
        }
    }
}
