package com.gt.linker.remote;

import com.gt.linker.model.CompositeKnowledgePointId;

// Addresses a point on the server. Composite ids use the v2 endpoints, numeric ids the legacy ones.
public record RemoteKnowledgePointKey(CompositeKnowledgePointId compositeId, Long legacyId) {

    public static RemoteKnowledgePointKey composite(CompositeKnowledgePointId compositeId) {
        return new RemoteKnowledgePointKey(compositeId, null);
    }

    public static RemoteKnowledgePointKey legacy(long legacyId) {
        return new RemoteKnowledgePointKey(null, legacyId);
    }

    public boolean isComposite() {
        return compositeId != null;
    }
}
