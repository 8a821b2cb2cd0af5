package com.gt.linker.knowledgePoint.model;

import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.MasteryTier;
import com.gt.linker.model.Origin;

import java.time.Instant;

public record KnowledgePointView(String effectiveId,
                                 String category,
                                 String subcategory,
                                 String correctPhrase,
                                 String explanation,
                                 String userContextSentence,
                                 String incorrectPhraseInContext,
                                 String keyPointSummary,
                                 double masteryLevel,
                                 MasteryTier tier,
                                 int mistakeCount,
                                 int correctCount,
                                 Instant nextReviewDate,
                                 Instant lastAiReviewDate,
                                 String aiReviewNotes,
                                 boolean archived,
                                 Origin origin,
                                 boolean cloudActionsEnabled) {

    public static KnowledgePointView of(KnowledgePoint point, String effectiveId, MasteryTier tier) {
        return new KnowledgePointView(
                effectiveId,
                point.category(),
                point.subcategory(),
                point.correctPhrase(),
                point.explanation(),
                point.userContextSentence(),
                point.incorrectPhraseInContext(),
                point.keyPointSummary(),
                point.masteryLevel(),
                tier,
                point.mistakeCount(),
                point.correctCount(),
                point.nextReviewDate(),
                point.lastAiReviewDate(),
                point.aiReviewNotes(),
                point.archived(),
                point.origin(),
                !point.isLocalOnly());
    }
}
