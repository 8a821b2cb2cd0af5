package com.gt.linker.model;

// severity is only meaningful for incorrect answers and may be null
public record ReviewOutcome(boolean correct, Severity severity) {

    public static ReviewOutcome correctAnswer() {
        return new ReviewOutcome(true, null);
    }

    public static ReviewOutcome incorrectAnswer(Severity severity) {
        return new ReviewOutcome(false, severity);
    }
}
