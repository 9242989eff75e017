package com.dataflywheel.evaluation;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LexicalResponseJudgeTest {
    private final LexicalResponseJudge judge = new LexicalResponseJudge();

    @Test
    void shouldTreatCaseAndWhitespaceDifferencesAsEqual() {
        assertEquals(1.0, judge.similarity("Use the  reset link.", "use the reset link.", List.of()), 1e-9);
    }

    @Test
    void shouldScoreTokenOverlapAsF1() {
        assertEquals(2.0 / 3.0, judge.similarity("the cat sat", "the cat ran", List.of()), 1e-9);
        assertEquals(0.0, judge.similarity("answer-5", "nope", List.of()), 1e-9);
    }

    @Test
    void shouldScoreEmptyCandidateAsZero() {
        assertEquals(0.0, judge.similarity("hello there", null, List.of()), 1e-9);
        assertEquals(1.0, judge.similarity("", null, List.of()), 1e-9);
    }
}
