package com.gt.linker.local;

import com.gt.linker.model.KnowledgePoint;

public record LocalKnowledgePointRow(long rowId, KnowledgePoint point) { }
