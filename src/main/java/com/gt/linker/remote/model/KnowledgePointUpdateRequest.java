package com.gt.linker.remote.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KnowledgePointUpdateRequest(@JsonProperty("mastery_level") Double masteryLevel,
                                          @JsonProperty("mistake_count") Integer mistakeCount,
                                          @JsonProperty("correct_count") Integer correctCount,
                                          @JsonProperty("review_streak") Integer reviewStreak,
                                          @JsonProperty("next_review_date") String nextReviewDate) { }
