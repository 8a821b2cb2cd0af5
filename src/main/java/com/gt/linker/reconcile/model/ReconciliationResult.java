package com.gt.linker.reconcile.model;

import com.gt.linker.model.KnowledgePoint;

import java.util.List;

public record ReconciliationResult(List<KnowledgePoint> promoted,
                                   List<ReconciliationConflict> conflicts,
                                   List<KnowledgePoint> passedThrough) {

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
