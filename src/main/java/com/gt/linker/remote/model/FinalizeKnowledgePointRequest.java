package com.gt.linker.remote.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FinalizeKnowledgePointRequest(@JsonProperty("question_data") QuestionData questionData,
                                            @JsonProperty("user_answer") String userAnswer,
                                            @JsonProperty("error_analyses") List<ErrorAnalysis> errorAnalyses,
                                            @JsonProperty("submitted_at") String submittedAt) {

    public record QuestionData(@JsonProperty("new_sentence") String newSentence,
                               @JsonProperty("type") String type,
                               @JsonProperty("mastery_level") double masteryLevel) { }

    public record ErrorAnalysis(@JsonProperty("category") String category,
                                @JsonProperty("error_type_code") String errorTypeCode,
                                @JsonProperty("key_point_summary") String keyPointSummary,
                                @JsonProperty("original_phrase") String originalPhrase,
                                @JsonProperty("correction") String correction,
                                @JsonProperty("explanation") String explanation,
                                @JsonProperty("severity") String severity) { }
}
