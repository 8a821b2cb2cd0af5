package com.gt.linker.remote.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gt.linker.model.CompositeKnowledgePointId;

// Knowledge point as the server sends it. Dates arrive as ISO-8601 strings, either instants or plain dates.
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteKnowledgePoint(@JsonProperty("composite_id") CompositeKnowledgePointId compositeId,
                                   @JsonProperty("legacy_id") Long legacyId,
                                   @JsonProperty("id") Long id,
                                   @JsonProperty("category") String category,
                                   @JsonProperty("subcategory") String subcategory,
                                   @JsonProperty("correct_phrase") String correctPhrase,
                                   @JsonProperty("explanation") String explanation,
                                   @JsonProperty("user_context_sentence") String userContextSentence,
                                   @JsonProperty("incorrect_phrase_in_context") String incorrectPhraseInContext,
                                   @JsonProperty("key_point_summary") String keyPointSummary,
                                   @JsonProperty("mastery_level") Double masteryLevel,
                                   @JsonProperty("mistake_count") Integer mistakeCount,
                                   @JsonProperty("correct_count") Integer correctCount,
                                   @JsonProperty("review_streak") Integer reviewStreak,
                                   @JsonProperty("next_review_date") String nextReviewDate,
                                   @JsonProperty("last_ai_review_date") String lastAiReviewDate,
                                   @JsonProperty("ai_review_notes") String aiReviewNotes,
                                   @JsonProperty("is_archived") Boolean isArchived) { }
