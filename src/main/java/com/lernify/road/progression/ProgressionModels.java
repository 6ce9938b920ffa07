package com.lernify.road.progression;

import com.lernify.road.catalog.CatalogModels;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ProgressionModels {
    public record Attempt(String userId, String domain, int stepIndex, int score, int total, Instant attemptedAt) {}

    public record SubmitResult(int score, int total, boolean passed, List<Boolean> results) {}

    public record QuestionView(String prompt, List<String> options) {}

    public record StepView(int index,
                           CatalogModels.StepKind kind,
                           String title,
                           String description,
                           List<String> videos,
                           List<QuestionView> questions,
                           boolean locked) {}

    public record RoadmapView(String domain, List<StepView> steps, int progress) {}

    public record DashboardView(List<Attempt> attempts, Map<String, Integer> progressPercent) {}
}
