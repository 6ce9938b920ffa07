package com.lernify.road.catalog;

import java.util.List;
import java.util.Objects;

public class CatalogModels {
    public enum StepKind { LESSON, ASSESSMENT }

    public record Question(String prompt, List<String> options, int correctOptionIndex) {
        public Question {
            Objects.requireNonNull(prompt, "prompt");
            options = List.copyOf(options);
            if (correctOptionIndex < 0 || correctOptionIndex >= options.size()) {
                throw new IllegalArgumentException("correctOptionIndex " + correctOptionIndex
                        + " is outside options of size " + options.size() + " for: " + prompt);
            }
        }
    }

    public record QuestionSet(List<Question> questions) {
        public QuestionSet {
            questions = List.copyOf(questions);
        }

        public int size() {
            return questions.size();
        }

        public Question get(int position) {
            return questions.get(position);
        }
    }

    /** A lesson as authored, before it is placed into a domain's step sequence. */
    public record Lesson(String title, String description, List<String> videos, QuestionSet quiz) {
        public Lesson {
            Objects.requireNonNull(title, "title");
            videos = videos == null ? List.of() : List.copyOf(videos);
            Objects.requireNonNull(quiz, "quiz");
        }
    }

    public record Step(String domain,
                       int index,
                       StepKind kind,
                       String title,
                       String description,
                       List<String> videos,
                       QuestionSet questionSet) {
        public Step {
            if (index < 1) throw new IllegalArgumentException("Step index must start at 1, got " + index);
            Objects.requireNonNull(kind, "kind");
            videos = videos == null ? List.of() : List.copyOf(videos);
            Objects.requireNonNull(questionSet, "questionSet");
        }

        public static Step lesson(String domain, int index, Lesson lesson) {
            return new Step(domain, index, StepKind.LESSON, lesson.title(), lesson.description(), lesson.videos(), lesson.quiz());
        }

        public static Step assessment(String domain, int index, String title, String description, QuestionSet bank) {
            return new Step(domain, index, StepKind.ASSESSMENT, title, description, List.of(), bank);
        }

        public boolean isAssessment() {
            return kind == StepKind.ASSESSMENT;
        }
    }
}
