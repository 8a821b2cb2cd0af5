package com.gt.linker.model;

import java.time.Instant;

public record KnowledgePoint(CompositeKnowledgePointId compositeId,
                             Long legacyId,
                             Long ancientId,
                             String category,
                             String subcategory,
                             String correctPhrase,
                             String explanation,
                             String userContextSentence,
                             String incorrectPhraseInContext,
                             String keyPointSummary,
                             double masteryLevel,
                             int mistakeCount,
                             int correctCount,
                             int reviewStreak,
                             Instant nextReviewDate,
                             Instant lastAiReviewDate,
                             String aiReviewNotes,
                             boolean archived,
                             Origin origin,
                             Instant lastModified) {

    public static KnowledgePoint newGuestPoint(KnowledgePointContent content, Instant now) {
        return new KnowledgePoint(null, null, null,
                content.category(),
                content.subcategory(),
                content.correctPhrase(),
                content.explanation(),
                content.userContextSentence(),
                content.incorrectPhraseInContext(),
                content.keyPointSummary(),
                0.0, 0, 0, 0,
                null, null, null,
                false,
                Origin.Local,
                now);
    }

    public KnowledgePointContent content() {
        return new KnowledgePointContent(category, subcategory, correctPhrase, explanation,
                userContextSentence, incorrectPhraseInContext, keyPointSummary);
    }

    public boolean isLocalOnly() {
        return origin == Origin.Local;
    }

    public boolean hasSameContentKey(String otherCategory, String otherCorrectPhrase) {
        return safeEquals(category, otherCategory) && safeEquals(correctPhrase, otherCorrectPhrase);
    }

    public boolean hasSameContentKey(KnowledgePoint other) {
        return hasSameContentKey(other.category, other.correctPhrase);
    }

    public KnowledgePoint withArchived(boolean newArchived, Instant modified) {
        return new KnowledgePoint(compositeId, legacyId, ancientId, category, subcategory, correctPhrase, explanation,
                userContextSentence, incorrectPhraseInContext, keyPointSummary, masteryLevel, mistakeCount, correctCount,
                reviewStreak, nextReviewDate, lastAiReviewDate, aiReviewNotes, newArchived, origin, modified);
    }

    public KnowledgePoint withProgress(double newMasteryLevel, int newMistakeCount, int newCorrectCount, int newReviewStreak,
                                       Instant newNextReviewDate, Instant modified) {
        return new KnowledgePoint(compositeId, legacyId, ancientId, category, subcategory, correctPhrase, explanation,
                userContextSentence, incorrectPhraseInContext, keyPointSummary, newMasteryLevel, newMistakeCount, newCorrectCount,
                newReviewStreak, newNextReviewDate, lastAiReviewDate, aiReviewNotes, archived, origin, modified);
    }

    public KnowledgePoint withOrigin(Origin newOrigin, String newAiReviewNotes) {
        return new KnowledgePoint(compositeId, legacyId, ancientId, category, subcategory, correctPhrase, explanation,
                userContextSentence, incorrectPhraseInContext, keyPointSummary, masteryLevel, mistakeCount, correctCount,
                reviewStreak, nextReviewDate, lastAiReviewDate, newAiReviewNotes, archived, newOrigin, lastModified);
    }

    public KnowledgePoint promotedTo(CompositeKnowledgePointId newCompositeId, Instant modified) {
        return new KnowledgePoint(newCompositeId, legacyId, ancientId, category, subcategory, correctPhrase, explanation,
                userContextSentence, incorrectPhraseInContext, keyPointSummary, masteryLevel, mistakeCount, correctCount,
                reviewStreak, nextReviewDate, lastAiReviewDate, aiReviewNotes, archived, Origin.Remote, modified);
    }

    private static boolean safeEquals(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }
}
