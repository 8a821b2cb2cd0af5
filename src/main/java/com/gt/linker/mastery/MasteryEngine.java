package com.gt.linker.mastery;

import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.MasteryTier;
import com.gt.linker.model.ReviewOutcome;
import com.gt.linker.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Maps a review answer onto a knowledge point's progress fields.
 * <p>
 * Correct answers raise the mastery level and push the next review out on a doubling schedule keyed by
 * the current streak of correct answers. Incorrect answers drop the level by an amount scaled by the
 * severity of the mistake, reset the streak, and bring the next review back to the relearn delay.
 * The level is always kept within {@link MasteryTier#MIN_LEVEL} and {@link MasteryTier#MAX_LEVEL}.
 */
@Component
public class MasteryEngine {

    private static final Logger log = LoggerFactory.getLogger(MasteryEngine.class);

    private final double correctGain;
    private final double lowPenalty;
    private final double mediumPenalty;
    private final double highPenalty;
    private final double criticalPenalty;
    private final Duration baseInterval;
    private final double intervalMultiplier;
    private final Duration maxInterval;
    private final Duration relearnDelay;

    @Autowired
    public MasteryEngine(@Value("${linker.mastery.correctGain:0.5}") double correctGain,
                         @Value("${linker.mastery.lowPenalty:0.25}") double lowPenalty,
                         @Value("${linker.mastery.mediumPenalty:0.5}") double mediumPenalty,
                         @Value("${linker.mastery.highPenalty:1.0}") double highPenalty,
                         @Value("${linker.mastery.criticalPenalty:1.5}") double criticalPenalty,
                         @Value("${linker.mastery.baseIntervalHours:24}") int baseIntervalHours,
                         @Value("${linker.mastery.intervalMultiplier:2.0}") double intervalMultiplier,
                         @Value("${linker.mastery.maxIntervalDays:180}") int maxIntervalDays,
                         @Value("${linker.mastery.relearnDelayMinutes:60}") int relearnDelayMinutes) {
        this.correctGain = correctGain;
        this.lowPenalty = lowPenalty;
        this.mediumPenalty = mediumPenalty;
        this.highPenalty = highPenalty;
        this.criticalPenalty = criticalPenalty;
        this.baseInterval = Duration.ofHours(baseIntervalHours);
        this.intervalMultiplier = intervalMultiplier;
        this.maxInterval = Duration.ofDays(maxIntervalDays);
        this.relearnDelay = Duration.ofMinutes(relearnDelayMinutes);
    }

    public static MasteryEngine withDefaults() {
        return new MasteryEngine(0.5, 0.25, 0.5, 1.0, 1.5, 24, 2.0, 180, 60);
    }

    public KnowledgePoint applyOutcome(KnowledgePoint point, boolean wasCorrect, Severity severity, Instant now) {
        return applyOutcome(point, new ReviewOutcome(wasCorrect, severity), now);
    }

    public KnowledgePoint applyOutcome(KnowledgePoint point, ReviewOutcome outcome, Instant now) {
        double currentLevel = clamp(point.masteryLevel());

        if (outcome.correct()) {
            int newStreak = point.reviewStreak() + 1;

            return point.withProgress(
                    clamp(currentLevel + correctGain),
                    point.mistakeCount(),
                    point.correctCount() + 1,
                    newStreak,
                    now.plus(reviewInterval(newStreak)),
                    now);
        } else {
            double newLevel = clamp(currentLevel - penaltyFor(outcome.severity()));
            log.debug("Mastery dropped from {} to {} after {} mistake", currentLevel, newLevel, outcome.severity());

            return point.withProgress(
                    newLevel,
                    point.mistakeCount() + 1,
                    point.correctCount(),
                    0,
                    now.plus(relearnDelay),
                    now);
        }
    }

    public MasteryTier tierOf(KnowledgePoint point) {
        return MasteryTier.of(clamp(point.masteryLevel()));
    }

    Duration reviewInterval(int streak) {
        if (streak <= 1) {
            return baseInterval;
        }

        double intervalMillis = baseInterval.toMillis() * Math.pow(intervalMultiplier, streak - 1);
        if (Double.isInfinite(intervalMillis) || intervalMillis >= maxInterval.toMillis()) {
            return maxInterval;
        }

        return Duration.ofMillis((long) intervalMillis);
    }

    double penaltyFor(Severity severity) {
        if (severity == Severity.Low) {
            return lowPenalty;
        } else if (severity == Severity.High) {
            return highPenalty;
        } else if (severity == Severity.Critical) {
            return criticalPenalty;
        }

        // unknown severities arrive as null and count as medium
        return mediumPenalty;
    }

    public static double clamp(double level) {
        if (Double.isNaN(level)) {
            return MasteryTier.MIN_LEVEL;
        }

        return Math.max(MasteryTier.MIN_LEVEL, Math.min(MasteryTier.MAX_LEVEL, level));
    }
}
