package com.gt.linker.remote.converter;

import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.MasteryTier;
import com.gt.linker.remote.model.FinalizeKnowledgePointRequest;
import com.gt.linker.remote.model.KnowledgePointUpdateRequest;
import com.gt.linker.remote.model.RemoteKnowledgePoint;
import com.gt.linker.util.TestUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class RemoteKnowledgePointConverterTests {

    @Test
    public void testParseDateFormats() {
        assertEquals(Instant.parse("2024-03-05T00:00:00Z"), RemoteKnowledgePointConverter.parseDate("2024-03-05"));
        assertEquals(Instant.parse("2024-03-05T10:15:30Z"), RemoteKnowledgePointConverter.parseDate("2024-03-05T10:15:30Z"));
        assertEquals(Instant.parse("2024-03-05T08:15:30Z"), RemoteKnowledgePointConverter.parseDate("2024-03-05T10:15:30+02:00"));
        assertEquals(Instant.parse("2024-03-05T10:15:30Z"), RemoteKnowledgePointConverter.parseDate("2024-03-05T10:15:30"));
        assertNull(RemoteKnowledgePointConverter.parseDate(""));
        assertNull(RemoteKnowledgePointConverter.parseDate(null));
        assertNull(RemoteKnowledgePointConverter.parseDate("next tuesday"));
    }

    @Test
    public void testFinalizeRequestCarriesContentAndMastery() {
        KnowledgePoint point = TestUtils.withMastery(TestUtils.guestPoint("grammar", "went"), 2.0);

        FinalizeKnowledgePointRequest request = RemoteKnowledgePointConverter.convertToFinalizeRequest(point, TestUtils.TEST_NOW);

        assertEquals(2.0, request.questionData().masteryLevel());
        assertEquals(point.userContextSentence(), request.userAnswer());
        assertEquals(1, request.errorAnalyses().size());
        assertEquals("went", request.errorAnalyses().get(0).correction());
        assertEquals("A1", request.errorAnalyses().get(0).errorTypeCode());
        assertEquals(TestUtils.TEST_NOW.toString(), request.submittedAt());
    }

    @Test
    public void testMasteryUpdateWithoutNextReview() {
        KnowledgePointUpdateRequest request = RemoteKnowledgePointConverter.convertToMasteryUpdate(TestUtils.guestPoint("grammar", "went"));

        assertEquals(0.0, request.masteryLevel());
        assertNull(request.nextReviewDate());
    }

    @Test
    public void testRemoteMasteryIsClampedIntoRange() {
        KnowledgePoint tooHigh = RemoteKnowledgePointConverter.convertRemoteKnowledgePoint(remotePointWithMastery(7.0), TestUtils.TEST_NOW);
        KnowledgePoint negative = RemoteKnowledgePointConverter.convertRemoteKnowledgePoint(remotePointWithMastery(-1.5), TestUtils.TEST_NOW);
        KnowledgePoint missing = RemoteKnowledgePointConverter.convertRemoteKnowledgePoint(remotePointWithMastery(null), TestUtils.TEST_NOW);
        KnowledgePoint inRange = RemoteKnowledgePointConverter.convertRemoteKnowledgePoint(remotePointWithMastery(2.5), TestUtils.TEST_NOW);

        assertEquals(MasteryTier.MAX_LEVEL, tooHigh.masteryLevel());
        assertEquals(MasteryTier.MIN_LEVEL, negative.masteryLevel());
        assertEquals(0.0, missing.masteryLevel());
        assertEquals(2.5, inRange.masteryLevel());
    }

    private static RemoteKnowledgePoint remotePointWithMastery(Double masteryLevel) {
        return new RemoteKnowledgePoint(new CompositeKnowledgePointId(7, 1), null, null, "grammar", "A1", "went",
                null, null, null, null, masteryLevel, 0, 0, 0, null, null, null, false);
    }
}
