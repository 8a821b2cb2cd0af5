package com.gt.linker.remote.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gt.linker.model.CompositeKnowledgePointId;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BatchActionRequest(@JsonProperty("action") String action,
                                 @JsonProperty("composite_ids") List<CompositeKnowledgePointId> compositeIds,
                                 @JsonProperty("legacy_ids") List<Long> legacyIds) { }
