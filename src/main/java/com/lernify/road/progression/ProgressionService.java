package com.lernify.road.progression;

import com.lernify.road.catalog.CatalogModels.Step;
import com.lernify.road.catalog.CurriculumCatalog;
import com.lernify.road.error.OutOfSequenceException;
import com.lernify.road.grading.GradeResult;
import com.lernify.road.grading.GradingEngine;
import com.lernify.road.progression.ProgressionModels.*;
import com.lernify.road.repository.AttemptJdbcRepository;
import com.lernify.road.repository.ProgressJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces the one-step-at-a-time roadmap: a user may only submit the step right after the last
 * one they passed, and passing advances their progress in that domain.
 */
@Service
public class ProgressionService {
    private static final Logger log = LoggerFactory.getLogger(ProgressionService.class);

    private final CurriculumCatalog catalog;
    private final GradingEngine gradingEngine;
    private final ProgressJdbcRepository progressRepository;
    private final AttemptJdbcRepository attemptRepository;

    // fixed pool of locks; a (user, domain) pair always maps to the same stripe
    static final int LOCK_STRIPES = 64;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public ProgressionService(CurriculumCatalog catalog,
                              GradingEngine gradingEngine,
                              ProgressJdbcRepository progressRepository,
                              AttemptJdbcRepository attemptRepository) {
        this.catalog = catalog;
        this.gradingEngine = gradingEngine;
        this.progressRepository = progressRepository;
        this.attemptRepository = attemptRepository;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public List<String> listDomains() {
        return catalog.domains();
    }

    public SubmitResult submitAssessment(String userId, String domain, int stepIndex, List<Integer> answers) {
        Step step = catalog.step(domain, stepIndex);

        ReentrantLock lock = lockFor(userId, domain);
        lock.lock();
        try {
            int completed = progressRepository.completed(userId, domain);
            if (stepIndex != completed + 1) {
                throw new OutOfSequenceException(domain, completed, stepIndex);
            }

            GradeResult grade = gradingEngine.grade(step.questionSet(), answers);
            attemptRepository.append(new Attempt(userId, domain, stepIndex, grade.score(), grade.total(), Instant.now()));

            if (grade.passed()) {
                if (progressRepository.compareAndAdvance(userId, domain, completed, stepIndex)) {
                    log.info("User {} advanced to step {} in {}", userId, stepIndex, domain);
                } else {
                    log.debug("Progress for user {} in {} moved past {} concurrently", userId, domain, completed);
                }
            }
            return new SubmitResult(grade.score(), grade.total(), grade.passed(), grade.results());
        } finally {
            lock.unlock();
        }
    }

    public RoadmapView roadmap(String userId, String domain) {
        List<Step> steps = catalog.steps(domain);
        int completed = progressRepository.completed(userId, domain);
        List<StepView> views = steps.stream()
                .map(step -> toView(step, isLocked(step.index(), completed)))
                .toList();
        return new RoadmapView(domain, views, completed);
    }

    public DashboardView dashboard(String userId) {
        Map<String, Integer> progress = progressRepository.progress(userId);
        Map<String, Integer> percent = new LinkedHashMap<>();
        for (String domain : catalog.domains()) {
            percent.put(domain, progressPercent(progress.getOrDefault(domain, 0), catalog.stepCount(domain)));
        }
        return new DashboardView(attemptRepository.findByUser(userId), percent);
    }

    ReentrantLock lockFor(String userId, String domain) {
        return locks[Math.floorMod(new ProgressKey(userId, domain).hashCode(), LOCK_STRIPES)];
    }

    /** Every step up to and including the next one to attempt is open. */
    static boolean isLocked(int stepIndex, int completed) {
        return stepIndex > completed + 1;
    }

    static int progressPercent(int completed, int stepCount) {
        if (stepCount <= 0) return 0;
        return (int) ((100L * completed) / stepCount);
    }

    private StepView toView(Step step, boolean locked) {
        List<QuestionView> questions = step.questionSet().questions().stream()
                .map(q -> new QuestionView(q.prompt(), q.options()))
                .toList();
        return new StepView(step.index(), step.kind(), step.title(), step.description(), step.videos(), questions, locked);
    }

    private record ProgressKey(String userId, String domain) {}
}
