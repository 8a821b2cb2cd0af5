package com.gt.linker.remote.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gt.linker.model.CompositeKnowledgePointId;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FinalizeKnowledgePointResponse(@JsonProperty("saved_count") int savedCount,
                                             @JsonProperty("composite_ids") List<CompositeKnowledgePointId> compositeIds,
                                             @JsonProperty("message") String message) { }
