package com.lernify.road.catalog;

import com.lernify.road.catalog.CatalogModels.Lesson;
import com.lernify.road.catalog.CatalogModels.Question;
import com.lernify.road.catalog.CatalogModels.QuestionSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static roadmap content. Domain order here is the order {@code /api/domains} lists them in.
 */
public final class RoadmapContent {
    public static final int ASSESSMENT_QUESTION_COUNT = 20;

    public static final String FRONTEND = "Frontend Development";
    public static final String BACKEND = "Backend Development";
    public static final String AI_ML = "AI/ML";
    public static final String DATA_SCIENCE = "Data Science";
    public static final String DEVOPS = "DevOps";

    private static final QuestionSet ASSESSMENT_BANK = new QuestionSet(List.of(
            q("What does CPU stand for?", 0, "Central Processing Unit", "Computer Personal Unit", "Central Program Utility"),
            q("Which data structure works first-in, first-out?", 1, "Stack", "Queue", "Tree"),
            q("Binary search on a sorted array runs in", 0, "O(log n)", "O(n)", "O(n^2)"),
            q("Which keyword creates a constant in JavaScript?", 2, "var", "let", "const"),
            q("Git command that records staged changes", 0, "git commit", "git push", "git clone"),
            q("HTTP method usually used to create a resource", 1, "GET", "POST", "HEAD"),
            q("SQL clause that filters rows", 0, "WHERE", "ORDER BY", "GROUP BY"),
            q("JSON stands for", 0, "JavaScript Object Notation", "Java Serialized Object Network"),
            q("Which one is a version control system?", 2, "Docker", "Nginx", "Git"),
            q("A primary key must be", 0, "Unique", "Nullable", "Encrypted"),
            q("Which HTTP status means Not Found?", 1, "500", "404", "301"),
            q("Recursion needs a", 0, "Base case", "Global variable", "Loop counter"),
            q("Python keyword to define a function", 0, "def", "func", "function"),
            q("Which is not a programming language?", 2, "Python", "Java", "HTML"),
            q("Hash map average lookup cost", 0, "O(1)", "O(log n)", "O(n)"),
            q("TCP is", 1, "Connectionless", "Connection-oriented"),
            q("Which command lists files in a Unix shell?", 0, "ls", "cd", "pwd"),
            q("An API is", 0, "An interface between programs", "A database engine", "A text editor"),
            q("Which sorting algorithm has O(n log n) worst case?", 2, "Quick sort", "Bubble sort", "Merge sort"),
            q("Boolean values are", 0, "true and false", "0 to 9", "strings only")
    ));

    private RoadmapContent() {}

    public static QuestionSet assessmentBank() {
        return ASSESSMENT_BANK;
    }

    public static Map<String, List<Lesson>> lessons() {
        Map<String, List<Lesson>> lessons = new LinkedHashMap<>();
        lessons.put(FRONTEND, List.of(
                lesson("HTML & CSS Basics", "Learn structure and styling.",
                        List.of("https://www.youtube.com/watch?v=G3e-cpL7ofc", "https://www.youtube.com/watch?v=1Rs2ND1ryYc"),
                        q("HTML stands for?", 0, "HyperText Markup Language", "Hyperlinks and Text Markup Language"),
                        q("CSS is used for?", 0, "Styling", "Database")),
                lesson("JavaScript Fundamentals", "Variables, functions, DOM.",
                        List.of("https://www.youtube.com/watch?v=PkZNo7MFNFg"),
                        q("typeof null is?", 0, "object", "null")),
                lesson("React Basics", "Components and hooks.",
                        List.of("https://www.youtube.com/watch?v=bMknfKXIFA8"),
                        q("React is a ...", 0, "library", "framework"))
        ));
        lessons.put(BACKEND, List.of(
                lesson("HTTP & REST", "Understand APIs.",
                        List.of("https://www.youtube.com/watch?v=Q-BpqyOT3a8"),
                        q("HTTP status 200 means?", 0, "OK", "Not Found")),
                lesson("Databases", "SQL vs NoSQL.",
                        List.of("https://www.youtube.com/watch?v=ztHopE5Wnpc"),
                        q("MongoDB is ...", 0, "NoSQL", "SQL"))
        ));
        lessons.put(AI_ML, List.of(
                lesson("Python Basics", "Syntax and data structures.",
                        List.of("https://www.youtube.com/watch?v=_uQrJ0TkZlc"),
                        q("Which is a list?", 0, "[1,2,3]", "(1,2,3)")),
                lesson("NumPy & Pandas", "Data handling.",
                        List.of("https://www.youtube.com/watch?v=vmEHCJofslg"),
                        q("Pandas primary structure?", 0, "DataFrame", "Tensor"))
        ));
        lessons.put(DATA_SCIENCE, List.of(
                lesson("Statistics Essentials", "Distributions, mean, variance.",
                        List.of("https://www.youtube.com/watch?v=xxpc-HPKN28"),
                        q("The median of 1, 3, 9 is?", 0, "3", "4.33")),
                lesson("Data Visualization", "Charts that tell a story.",
                        List.of("https://www.youtube.com/watch?v=a9UrKTVEeZA"),
                        q("Best chart for a trend over time?", 1, "Pie chart", "Line chart"))
        ));
        lessons.put(DEVOPS, List.of(
                lesson("Linux & Shell", "Navigating and scripting the command line.",
                        List.of("https://www.youtube.com/watch?v=sWbUDq4S6Y8"),
                        q("Which command changes directory?", 0, "cd", "mv")),
                lesson("Containers", "Images, containers and registries.",
                        List.of("https://www.youtube.com/watch?v=fqMOX6JJhGo"),
                        q("A Docker image is ...", 0, "A read-only template", "A running process"))
        ));
        return lessons;
    }

    private static Lesson lesson(String title, String description, List<String> videos, Question... quiz) {
        return new Lesson(title, description, videos, new QuestionSet(List.of(quiz)));
    }

    private static Question q(String prompt, int correct, String... options) {
        return new Question(prompt, List.of(options), correct);
    }
}
