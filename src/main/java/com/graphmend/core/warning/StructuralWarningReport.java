package com.graphmend.core.warning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Warnings plus the union of their node ids, which downstream confidence
 * scoring treats as uncertain. Node ids keep first-seen order.
 */
public final class StructuralWarningReport {

    private final List<StructuralWarning> warnings;
    private final Set<String>             uncertainNodeIds;

    public StructuralWarningReport(List<StructuralWarning> warnings) {
        List<StructuralWarning> sorted = new ArrayList<>(warnings);
        sorted.sort(StructuralWarning.BY_SEVERITY);
        this.warnings = List.copyOf(sorted);

        Set<String> uncertain = new LinkedHashSet<>();
        for (StructuralWarning warning : this.warnings) {
            uncertain.addAll(warning.getNodeIds());
        }
        this.uncertainNodeIds = Collections.unmodifiableSet(uncertain);
    }

    public static StructuralWarningReport empty() {
        return new StructuralWarningReport(List.of());
    }

    public List<StructuralWarning> getWarnings()         { return warnings; }
    public Set<String>             getUncertainNodeIds() { return uncertainNodeIds; }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public boolean has(StructuralWarningType type) {
        return warnings.stream().anyMatch(w -> w.getType() == type);
    }
}
