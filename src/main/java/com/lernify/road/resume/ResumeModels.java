package com.lernify.road.resume;

import java.util.List;
import java.util.Map;

public class ResumeModels {
    public record Resume(String summary,
                         List<String> skills,
                         List<Map<String, Object>> education,
                         List<Map<String, Object>> experience,
                         List<Map<String, Object>> projects) {
        public Resume {
            summary = summary == null ? "" : summary;
            skills = skills == null ? List.of() : skills;
            education = education == null ? List.of() : education;
            experience = experience == null ? List.of() : experience;
            projects = projects == null ? List.of() : projects;
        }

        public static Resume empty() {
            return new Resume("", List.of(), List.of(), List.of(), List.of());
        }
    }

    public record ResumeHtml(String html) {}
}
