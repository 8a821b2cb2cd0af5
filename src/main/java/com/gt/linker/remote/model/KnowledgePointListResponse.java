package com.gt.linker.remote.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KnowledgePointListResponse(@JsonProperty("knowledge_points") List<RemoteKnowledgePoint> knowledgePoints) { }
