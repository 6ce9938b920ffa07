package com.lernify.road.profile;

import jakarta.validation.constraints.Size;

import java.util.Map;

public class ProfileModels {
    public record Profile(String firstName,
                          String lastName,
                          String email,
                          String phone,
                          String qualification,
                          Map<String, Integer> progress) {}

    /** Null fields are left unchanged. */
    public record UpdateProfileRequest(@Size(min = 2, max = 50) String firstName,
                                       @Size(min = 2, max = 50) String lastName,
                                       @Size(min = 10, max = 15) String phone) {}
}
