package com.lernify.road.grading;

import java.util.List;

public record GradeResult(int score, int total, boolean passed, List<Boolean> results) {
    public GradeResult {
        results = List.copyOf(results);
    }
}
