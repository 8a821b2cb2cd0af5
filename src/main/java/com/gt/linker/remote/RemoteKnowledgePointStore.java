package com.gt.linker.remote;

import com.gt.linker.model.BatchAction;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;

import java.util.List;

/**
 * The authoritative server-side store. Implementations translate transport failures into
 * {@link com.gt.linker.exception.RemoteUnreachableException} and server refusals into
 * {@link com.gt.linker.exception.RemoteRejectedException}.
 */
public interface RemoteKnowledgePointStore {

    CompositeKnowledgePointId create(KnowledgePoint point);

    List<KnowledgePoint> fetchActive();

    List<KnowledgePoint> fetchArchived();

    void archive(RemoteKnowledgePointKey key);

    void unarchive(RemoteKnowledgePointKey key);

    void delete(RemoteKnowledgePointKey key);

    void updateMastery(RemoteKnowledgePointKey key, KnowledgePoint updatedPoint);

    void batchAction(BatchAction action, List<RemoteKnowledgePointKey> keys);
}
