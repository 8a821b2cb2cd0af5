package com.gt.linker.mastery;

import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.MasteryTier;
import com.gt.linker.model.ReviewOutcome;
import com.gt.linker.model.Severity;
import com.gt.linker.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class MasteryEngineTests {

    private MasteryEngine masteryEngine;

    @BeforeEach
    public void setup() {
        masteryEngine = MasteryEngine.withDefaults();
    }

    @Test
    public void testCorrectAnswerRaisesLevelAndSchedulesReview() {
        KnowledgePoint point = TestUtils.withMastery(TestUtils.guestPoint("grammar", "went"), 1.0);

        KnowledgePoint updated = masteryEngine.applyOutcome(point, true, null, TestUtils.TEST_NOW);

        assertEquals(1.5, updated.masteryLevel(), 0.0001);
        assertEquals(1, updated.correctCount());
        assertEquals(0, updated.mistakeCount());
        assertEquals(1, updated.reviewStreak());
        assertEquals(TestUtils.TEST_NOW.plus(Duration.ofHours(24)), updated.nextReviewDate());
        assertEquals(TestUtils.TEST_NOW, updated.lastModified());
    }

    @Test
    public void testThreeCorrectAnswersReachMediumWithGrowingIntervals() {
        KnowledgePoint point = TestUtils.withMastery(TestUtils.guestPoint("grammar", "went"), 1.0);
        Instant now = TestUtils.TEST_NOW;
        Duration previousInterval = Duration.ZERO;

        for (int review = 0; review < 3; review++) {
            point = masteryEngine.applyOutcome(point, ReviewOutcome.correctAnswer(), now);

            Duration interval = Duration.between(now, point.nextReviewDate());
            assertTrue(interval.compareTo(previousInterval) > 0);

            previousInterval = interval;
            now = point.nextReviewDate();
        }

        assertTrue(masteryEngine.tierOf(point).compareTo(MasteryTier.Medium) >= 0);
        assertEquals(3, point.correctCount());
    }

    @Test
    public void testIncorrectAnswerPenaltyScalesWithSeverity() {
        KnowledgePoint point = TestUtils.withMastery(TestUtils.guestPoint("grammar", "went"), 4.0);

        double low = masteryEngine.applyOutcome(point, false, Severity.Low, TestUtils.TEST_NOW).masteryLevel();
        double medium = masteryEngine.applyOutcome(point, false, Severity.Medium, TestUtils.TEST_NOW).masteryLevel();
        double high = masteryEngine.applyOutcome(point, false, Severity.High, TestUtils.TEST_NOW).masteryLevel();
        double critical = masteryEngine.applyOutcome(point, false, Severity.Critical, TestUtils.TEST_NOW).masteryLevel();

        assertTrue(low > medium);
        assertTrue(medium > high);
        assertTrue(high > critical);
        assertEquals(medium, masteryEngine.applyOutcome(point, false, null, TestUtils.TEST_NOW).masteryLevel(), 0.0001);
    }

    @Test
    public void testIncorrectAnswerResetsStreakAndSchedulesRelearn() {
        KnowledgePoint point = TestUtils.guestPoint("grammar", "went");
        point = masteryEngine.applyOutcome(point, ReviewOutcome.correctAnswer(), TestUtils.TEST_NOW);
        point = masteryEngine.applyOutcome(point, ReviewOutcome.correctAnswer(), TestUtils.TEST_NOW);

        KnowledgePoint updated = masteryEngine.applyOutcome(point, ReviewOutcome.incorrectAnswer(Severity.High), TestUtils.TEST_NOW);

        assertEquals(0, updated.reviewStreak());
        assertEquals(1, updated.mistakeCount());
        assertEquals(2, updated.correctCount());
        assertEquals(TestUtils.TEST_NOW.plus(Duration.ofMinutes(60)), updated.nextReviewDate());
    }

    @Test
    public void testLevelStaysInRangeOverLongStreaks() {
        KnowledgePoint point = TestUtils.guestPoint("grammar", "went");

        for (int i = 0; i < 1000; i++) {
            point = masteryEngine.applyOutcome(point, ReviewOutcome.correctAnswer(), TestUtils.TEST_NOW);
            assertTrue(point.masteryLevel() <= MasteryTier.MAX_LEVEL);
        }
        assertEquals(MasteryTier.MAX_LEVEL, point.masteryLevel(), 0.0001);
        assertEquals(TestUtils.TEST_NOW.plus(Duration.ofDays(180)), point.nextReviewDate());

        for (int i = 0; i < 1000; i++) {
            point = masteryEngine.applyOutcome(point, ReviewOutcome.incorrectAnswer(Severity.Critical), TestUtils.TEST_NOW);
            assertTrue(point.masteryLevel() >= MasteryTier.MIN_LEVEL);
        }
        assertEquals(MasteryTier.MIN_LEVEL, point.masteryLevel(), 0.0001);
    }

    @Test
    public void testLevelStaysInRangeOverRandomOutcomes() {
        Random random = new Random(12345);
        Severity[] severities = Severity.values();
        KnowledgePoint point = TestUtils.guestPoint("grammar", "went");

        for (int i = 0; i < 1000; i++) {
            ReviewOutcome outcome = random.nextBoolean()
                    ? ReviewOutcome.correctAnswer()
                    : ReviewOutcome.incorrectAnswer(severities[random.nextInt(severities.length)]);

            point = masteryEngine.applyOutcome(point, outcome, TestUtils.TEST_NOW);

            assertTrue(point.masteryLevel() >= MasteryTier.MIN_LEVEL && point.masteryLevel() <= MasteryTier.MAX_LEVEL);
        }
    }

    @Test
    public void testOutOfRangeLevelIsClampedBeforeApplying() {
        KnowledgePoint point = TestUtils.withMastery(TestUtils.guestPoint("grammar", "went"), 42.0);

        assertEquals(MasteryTier.MAX_LEVEL, masteryEngine.applyOutcome(point, true, null, TestUtils.TEST_NOW).masteryLevel(), 0.0001);
        assertEquals(MasteryTier.Strong, masteryEngine.tierOf(point));
        assertEquals(MasteryTier.Weak, masteryEngine.tierOf(TestUtils.withMastery(point, Double.NaN)));
    }

    @Test
    public void testReviewIntervalDoublesUpToCap() {
        assertEquals(Duration.ofHours(24), masteryEngine.reviewInterval(1));
        assertEquals(Duration.ofHours(48), masteryEngine.reviewInterval(2));
        assertEquals(Duration.ofHours(96), masteryEngine.reviewInterval(3));
        assertEquals(Duration.ofDays(180), masteryEngine.reviewInterval(40));
        assertEquals(Duration.ofDays(180), masteryEngine.reviewInterval(5000));
    }
}
