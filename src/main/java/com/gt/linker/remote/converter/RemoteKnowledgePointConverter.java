package com.gt.linker.remote.converter;

import com.gt.linker.mastery.MasteryEngine;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.Origin;
import com.gt.linker.model.Severity;
import com.gt.linker.remote.model.FinalizeKnowledgePointRequest;
import com.gt.linker.remote.model.KnowledgePointUpdateRequest;
import com.gt.linker.remote.model.RemoteKnowledgePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

public class RemoteKnowledgePointConverter {

    private static final Logger log = LoggerFactory.getLogger(RemoteKnowledgePointConverter.class);

    private static final int DATE_ONLY_LENGTH = 10;
    private static final Pattern ZONED_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:\\d{2})$");

    private static final String REVIEW_QUESTION_TYPE = "review";
    private static final String DEFAULT_ERROR_TYPE_CODE = "B";

    public static KnowledgePoint convertRemoteKnowledgePoint(RemoteKnowledgePoint remotePoint, Instant fetchedAt) {
        return new KnowledgePoint(
                remotePoint.compositeId(),
                remotePoint.legacyId(),
                remotePoint.id(),
                remotePoint.category(),
                remotePoint.subcategory(),
                remotePoint.correctPhrase(),
                remotePoint.explanation(),
                remotePoint.userContextSentence(),
                remotePoint.incorrectPhraseInContext(),
                remotePoint.keyPointSummary(),
                toMasteryLevel(remotePoint.masteryLevel()),
                remotePoint.mistakeCount() == null ? 0 : remotePoint.mistakeCount(),
                remotePoint.correctCount() == null ? 0 : remotePoint.correctCount(),
                remotePoint.reviewStreak() == null ? 0 : remotePoint.reviewStreak(),
                parseDate(remotePoint.nextReviewDate()),
                parseDate(remotePoint.lastAiReviewDate()),
                remotePoint.aiReviewNotes(),
                Boolean.TRUE.equals(remotePoint.isArchived()),
                Origin.Remote,
                fetchedAt);
    }

    static double toMasteryLevel(Double remoteLevel) {
        if (remoteLevel == null) {
            return 0.0;
        }

        double level = MasteryEngine.clamp(remoteLevel);
        if (level != remoteLevel) {
            log.warn("Server sent mastery level {} outside the supported range, using {}", remoteLevel, level);
        }

        return level;
    }

    public static List<KnowledgePoint> convertRemoteKnowledgePoints(List<RemoteKnowledgePoint> remotePoints, Instant fetchedAt) {
        if (remotePoints == null) {
            return List.of();
        }

        return remotePoints.stream()
                .map(remotePoint -> convertRemoteKnowledgePoint(remotePoint, fetchedAt))
                .toList();
    }

    public static FinalizeKnowledgePointRequest convertToFinalizeRequest(KnowledgePoint point, Instant submittedAt) {
        String userAnswer = point.userContextSentence() == null ? "" : point.userContextSentence();

        return new FinalizeKnowledgePointRequest(
                new FinalizeKnowledgePointRequest.QuestionData(userAnswer, REVIEW_QUESTION_TYPE, point.masteryLevel()),
                userAnswer,
                List.of(new FinalizeKnowledgePointRequest.ErrorAnalysis(
                        point.category(),
                        point.subcategory() == null || point.subcategory().isBlank() ? DEFAULT_ERROR_TYPE_CODE : point.subcategory(),
                        nullToEmpty(point.keyPointSummary()),
                        nullToEmpty(point.incorrectPhraseInContext()),
                        point.correctPhrase(),
                        nullToEmpty(point.explanation()),
                        Severity.Medium.getCode())),
                submittedAt.toString());
    }

    public static KnowledgePointUpdateRequest convertToMasteryUpdate(KnowledgePoint point) {
        return new KnowledgePointUpdateRequest(
                point.masteryLevel(),
                point.mistakeCount(),
                point.correctCount(),
                point.reviewStreak(),
                point.nextReviewDate() == null ? null : point.nextReviewDate().toString());
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }

        try {
            if (value.length() == DATE_ONLY_LENGTH) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } else if (ZONED_SUFFIX.matcher(value).find()) {
                return Instant.parse(value);
            }

            // the server omits the zone on naive timestamps, they are UTC
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unreadable date {} from server", value, ex);
            return null;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
