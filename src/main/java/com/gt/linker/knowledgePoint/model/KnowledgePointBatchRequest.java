package com.gt.linker.knowledgePoint.model;

import java.util.List;

public record KnowledgePointBatchRequest(String action, List<String> ids) { }
