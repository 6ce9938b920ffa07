package com.lernify.road.api;

import com.lernify.road.auth.AuthModels;
import com.lernify.road.auth.BearerTokenFilter;
import com.lernify.road.profile.ProfileModels;
import com.lernify.road.profile.ProfileService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/me")
public class ProfileController {
    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public ResponseEntity<ProfileModels.Profile> me(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user) {
        return ResponseEntity.ok(profileService.profile(user.userId()));
    }

    @PutMapping
    public ResponseEntity<Map<String, Boolean>> update(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user,
                                                       @Valid @RequestBody ProfileModels.UpdateProfileRequest request) {
        profileService.update(user.userId(), request);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
