package com.lernify.road.auth;

import java.util.Set;

/** Qualifications accepted at registration; only IT-related student degrees. */
public final class Qualifications {
    public static final Set<String> ALLOWED = Set.of(
            "BCA", "MCA", "BSc CS", "MSc CS", "B.Tech CSE", "BE CSE", "B.Tech IT", "BE IT",
            "Data Science", "AI/ML", "Computer Engineering", "Information Technology"
    );

    private Qualifications() {}
}
