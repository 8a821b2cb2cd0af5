package com.gt.linker.knowledgePoint.model;

import java.util.List;
import java.util.Map;

// failures maps effective id to the reason it was not applied
public record BatchActionResult(List<String> succeededIds, Map<String, String> failures) { }
