package com.gt.linker.local;

import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.Origin;

import java.util.Collection;
import java.util.List;

public interface LocalKnowledgePointDao {

    // Marker older clients wrote into ai_review_notes to flag guest rows
    String LEGACY_LOCAL_MARKER = "本地儲存";

    List<LocalKnowledgePointRow> loadAll();

    int insert(KnowledgePoint point);

    int updateLocalByContentKey(KnowledgePoint point);

    int countByOrigin(Origin origin);

    int deleteRows(Collection<Long> rowIds);

    int deleteByOrigin(Origin origin);

    void replaceCachedRemotePoints(boolean archived, List<KnowledgePoint> points);
}
