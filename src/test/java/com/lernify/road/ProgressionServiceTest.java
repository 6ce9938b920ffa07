package com.lernify.road;

import com.lernify.road.auth.AuthService;
import com.lernify.road.catalog.CatalogModels.QuestionSet;
import com.lernify.road.catalog.CurriculumCatalog;
import com.lernify.road.error.AnswerCountMismatchException;
import com.lernify.road.error.ErrorKind;
import com.lernify.road.error.NotFoundException;
import com.lernify.road.error.OutOfSequenceException;
import com.lernify.road.progression.ProgressionModels;
import com.lernify.road.progression.ProgressionService;
import com.lernify.road.repository.AttemptJdbcRepository;
import com.lernify.road.repository.ProgressJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static com.lernify.road.catalog.RoadmapContent.BACKEND;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ProgressionServiceTest {
    @Autowired
    private AuthService authService;
    @Autowired
    private ProgressionService progressionService;
    @Autowired
    private CurriculumCatalog catalog;
    @Autowired
    private ProgressJdbcRepository progressRepository;
    @Autowired
    private AttemptJdbcRepository attemptRepository;

    private String userId;

    @BeforeEach
    void registerStudent() {
        userId = TestUsers.register(authService);
    }

    @Test
    void passingFirstLessonAdvancesProgress() {
        var result = progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));
        assertEquals(1, result.score());
        assertEquals(1, result.total());
        assertTrue(result.passed());
        assertEquals(List.of(true), result.results());
        assertEquals(1, progressRepository.completed(userId, BACKEND));
    }

    @Test
    void skippingAheadIsOutOfSequenceAndRecordsNothing() {
        progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));

        OutOfSequenceException e = assertThrows(OutOfSequenceException.class,
                () -> progressionService.submitAssessment(userId, BACKEND, 3, List.of(0)));
        assertEquals(ErrorKind.OUT_OF_SEQUENCE, e.kind());
        assertEquals(1, e.completed());
        assertEquals(1, progressRepository.completed(userId, BACKEND));
        assertEquals(1, attemptsIn(BACKEND));
    }

    @Test
    void resubmittingPassedStepIsOutOfSequence() {
        progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));
        assertThrows(OutOfSequenceException.class,
                () -> progressionService.submitAssessment(userId, BACKEND, 1, List.of(0)));
        assertEquals(1, progressRepository.completed(userId, BACKEND));
        assertEquals(1, attemptsIn(BACKEND));
    }

    @Test
    void answerCountMismatchRecordsNothing() {
        progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));
        QuestionSet bank = catalog.step(BACKEND, 2).questionSet();

        assertThrows(AnswerCountMismatchException.class,
                () -> progressionService.submitAssessment(userId, BACKEND, 2, Answers.allCorrect(bank).subList(0, 19)));
        assertEquals(1, progressRepository.completed(userId, BACKEND));
        assertEquals(1, attemptsIn(BACKEND));
    }

    @Test
    void failingGradeRecordsAttemptButKeepsProgress() {
        progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));
        QuestionSet bank = catalog.step(BACKEND, 2).questionSet();

        var result = progressionService.submitAssessment(userId, BACKEND, 2, Answers.withCorrect(bank, 11));
        assertEquals(11, result.score());
        assertEquals(20, result.total());
        assertFalse(result.passed());
        assertEquals(1, progressRepository.completed(userId, BACKEND));
        assertEquals(2, attemptsIn(BACKEND));

        // the same step can be retried after a failure
        assertTrue(progressionService.submitAssessment(userId, BACKEND, 2, Answers.allCorrect(bank)).passed());
        assertEquals(2, progressRepository.completed(userId, BACKEND));
    }

    @Test
    void unknownDomainOrStepIsNotFound() {
        NotFoundException domain = assertThrows(NotFoundException.class,
                () -> progressionService.submitAssessment(userId, "Underwater Basketry", 1, List.of(0)));
        assertEquals(ErrorKind.DOMAIN_NOT_FOUND, domain.kind());

        NotFoundException step = assertThrows(NotFoundException.class,
                () -> progressionService.submitAssessment(userId, BACKEND, 42, List.of(0)));
        assertEquals(ErrorKind.STEP_NOT_FOUND, step.kind());
        assertEquals(0, attemptsIn(BACKEND));
    }

    @Test
    void completingWholeRoadmapReachesHundredPercent() {
        for (int index = 1; index <= catalog.stepCount(BACKEND); index++) {
            QuestionSet questions = catalog.step(BACKEND, index).questionSet();
            assertTrue(progressionService.submitAssessment(userId, BACKEND, index, Answers.allCorrect(questions)).passed());
        }
        assertEquals(100, progressionService.dashboard(userId).progressPercent().get(BACKEND));
        assertThrows(OutOfSequenceException.class,
                () -> progressionService.submitAssessment(userId, BACKEND, 5, Answers.allCorrect(catalog.step(BACKEND, 5).questionSet())));
        NotFoundException beyondEnd = assertThrows(NotFoundException.class,
                () -> progressionService.submitAssessment(userId, BACKEND, 6, List.of()));
        assertEquals(ErrorKind.STEP_NOT_FOUND, beyondEnd.kind());
        assertEquals(5, progressRepository.completed(userId, BACKEND));
        assertEquals(5, attemptsIn(BACKEND));
    }

    @Test
    void roadmapLocksStepsBeyondTheNextOne() {
        progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));

        ProgressionModels.RoadmapView roadmap = progressionService.roadmap(userId, BACKEND);
        assertEquals(1, roadmap.progress());
        assertEquals(List.of(false, false, true, true, true),
                roadmap.steps().stream().map(ProgressionModels.StepView::locked).toList());
        assertEquals(20, roadmap.steps().get(1).questions().size());
    }

    @Test
    void freshUserSeesOnlyFirstStepUnlocked() {
        ProgressionModels.RoadmapView roadmap = progressionService.roadmap(userId, BACKEND);
        assertEquals(0, roadmap.progress());
        assertFalse(roadmap.steps().get(0).locked());
        assertTrue(roadmap.steps().get(1).locked());
    }

    @Test
    void dashboardReportsAttemptsAndFlooredPercentages() {
        progressionService.submitAssessment(userId, BACKEND, 1, List.of(0));
        progressionService.submitAssessment(userId, BACKEND, 2, Answers.allCorrect(catalog.step(BACKEND, 2).questionSet()));

        ProgressionModels.DashboardView dashboard = progressionService.dashboard(userId);
        assertEquals(40, dashboard.progressPercent().get(BACKEND));
        assertEquals(catalog.domains(), List.copyOf(dashboard.progressPercent().keySet()));
        assertEquals(0, dashboard.progressPercent().get(catalog.domains().get(0)));
        assertEquals(2, dashboard.attempts().size());
        assertEquals(1, dashboard.attempts().get(0).stepIndex());
        assertEquals(20, dashboard.attempts().get(1).total());
    }

    @Test
    void concurrentSubmissionsOfTheSameStepAdvanceOnce() throws Exception {
        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger passed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        try {
            List<Future<?>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        if (progressionService.submitAssessment(userId, BACKEND, 1, List.of(0)).passed()) {
                            passed.incrementAndGet();
                        }
                    } catch (OutOfSequenceException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, passed.get());
        assertEquals(threads - 1, rejected.get());
        assertEquals(1, progressRepository.completed(userId, BACKEND));
        assertEquals(1, attemptsIn(BACKEND));
    }

    private long attemptsIn(String domain) {
        return attemptRepository.findByUser(userId).stream()
                .filter(a -> a.domain().equals(domain))
                .count();
    }
}
