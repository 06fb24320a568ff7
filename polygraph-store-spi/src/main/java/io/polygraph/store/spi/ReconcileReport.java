package io.polygraph.store.spi;

import java.util.List;

/**
 * Outcome of a reconciliation pass. Ids are listed whether or not they were repaired.
 *
 * @param orphans relations/attributes with a live source that no morph of the source references
 * @param danglingChildren relations/attributes whose source or target node is missing
 * @param danglingReferences morph references ({@code nodeId/childId}) to missing children
 * @param relinked orphans that were attached to their source's active morph
 * @param pruned children deleted and morph references dropped
 */
public record ReconcileReport(
        List<String> orphans,
        List<String> danglingChildren,
        List<String> danglingReferences,
        List<String> relinked,
        List<String> pruned
) {
    public ReconcileReport {
        orphans = List.copyOf(orphans);
        danglingChildren = List.copyOf(danglingChildren);
        danglingReferences = List.copyOf(danglingReferences);
        relinked = List.copyOf(relinked);
        pruned = List.copyOf(pruned);
    }

    public boolean clean() {
        return orphans.isEmpty() && danglingChildren.isEmpty() && danglingReferences.isEmpty();
    }
}
