package com.gt.linker.reconcile.model;

import com.gt.linker.model.KnowledgePoint;

public record ReconciliationConflict(KnowledgePoint point, ConflictReason reason, String message) { }
