package com.lernify.road.grading;

import com.lernify.road.catalog.CatalogModels.QuestionSet;
import com.lernify.road.error.AnswerCountMismatchException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores an answer list against a question set. Pure: nothing is recorded, so it may be
 * called before any state is touched.
 */
@Component
public class GradingEngine {
    /** Passing needs at least 6 correct answers out of every 10, i.e. score/total >= 0.6. */
    private static final int PASS_NUMERATOR = 6;
    private static final int PASS_DENOMINATOR = 10;

    /**
     * @param answers selected option index per question, in question order
     * @throws AnswerCountMismatchException when the answer list does not cover every question exactly once
     */
    public GradeResult grade(QuestionSet questionSet, List<Integer> answers) {
        int total = questionSet.size();
        if (answers == null || answers.size() != total) {
            throw new AnswerCountMismatchException(total, answers == null ? 0 : answers.size());
        }

        List<Boolean> results = new ArrayList<>(total);
        int score = 0;
        for (int i = 0; i < total; i++) {
            Integer answer = answers.get(i);
            boolean ok = answer != null && answer == questionSet.get(i).correctOptionIndex();
            results.add(ok);
            if (ok) score++;
        }
        return new GradeResult(score, total, passes(score, total), results);
    }

    // an empty question set passes vacuously; integer form avoids rounding at exactly 60%
    static boolean passes(int score, int total) {
        if (total == 0) return true;
        return (long) score * PASS_DENOMINATOR >= (long) total * PASS_NUMERATOR;
    }
}
