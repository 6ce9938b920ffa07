package com.lernify.road.catalog;

import com.lernify.road.catalog.CatalogModels.Lesson;
import com.lernify.road.catalog.CatalogModels.QuestionSet;
import com.lernify.road.catalog.CatalogModels.Step;
import com.lernify.road.error.NotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable table of every domain's ordered roadmap. Each domain's lessons are expanded to
 * {@code Lesson1, Assessment1, ..., LessonN, AssessmentN, FinalAssessment} with indices 1..2N+1,
 * and every assessment step shares the same question bank.
 */
public final class CurriculumCatalog {
    public static final String FINAL_ASSESSMENT_TITLE = "Final Assessment";

    private final Map<String, List<Step>> stepsByDomain;

    private CurriculumCatalog(Map<String, List<Step>> stepsByDomain) {
        this.stepsByDomain = stepsByDomain;
    }

    public static CurriculumCatalog build(Map<String, List<Lesson>> lessonsByDomain, QuestionSet assessmentBank) {
        Map<String, List<Step>> steps = new LinkedHashMap<>();
        lessonsByDomain.forEach((domain, lessons) -> steps.put(domain, expand(domain, lessons, assessmentBank)));
        steps.forEach(CurriculumCatalog::checkSequence);
        return new CurriculumCatalog(Collections.unmodifiableMap(steps));
    }

    private static List<Step> expand(String domain, List<Lesson> lessons, QuestionSet bank) {
        List<Step> steps = new ArrayList<>(lessons.size() * 2 + 1);
        int index = 1;
        for (Lesson lesson : lessons) {
            steps.add(Step.lesson(domain, index++, lesson));
            steps.add(Step.assessment(domain, index++, "Assessment: " + lesson.title(),
                    "Checks what you learned in \"" + lesson.title() + "\".", bank));
        }
        steps.add(Step.assessment(domain, index, FINAL_ASSESSMENT_TITLE,
                "Covers the whole " + domain + " roadmap.", bank));
        return List.copyOf(steps);
    }

    private static void checkSequence(String domain, List<Step> steps) {
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            if (step.index() != i + 1) {
                throw new IllegalStateException("Non-contiguous step index " + step.index() + " at position " + i + " in " + domain);
            }
            if (!step.isAssessment() && (i + 1 >= steps.size() || !steps.get(i + 1).isAssessment())) {
                throw new IllegalStateException("Lesson " + step.index() + " in " + domain + " is not followed by an assessment");
            }
        }
        if (steps.isEmpty() || !steps.get(steps.size() - 1).isAssessment()) {
            throw new IllegalStateException("Roadmap for " + domain + " must end with an assessment");
        }
    }

    public List<String> domains() {
        return List.copyOf(stepsByDomain.keySet());
    }

    public boolean contains(String domain) {
        return domain != null && stepsByDomain.containsKey(domain);
    }

    public List<Step> steps(String domain) {
        List<Step> steps = domain == null ? null : stepsByDomain.get(domain);
        if (steps == null) throw NotFoundException.domain(domain);
        return steps;
    }

    public int stepCount(String domain) {
        return steps(domain).size();
    }

    public Step step(String domain, int index) {
        List<Step> steps = steps(domain);
        if (index < 1 || index > steps.size()) throw NotFoundException.step(domain, index);
        return steps.get(index - 1);
    }
}
