package com.lernify.road.api;

import com.lernify.road.auth.AuthModels;
import com.lernify.road.auth.BearerTokenFilter;
import com.lernify.road.progression.ProgressionModels;
import com.lernify.road.progression.ProgressionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assessment")
public class AssessmentController {
    private final ProgressionService progressionService;

    public AssessmentController(ProgressionService progressionService) {
        this.progressionService = progressionService;
    }

    @PostMapping("/submit")
    public ResponseEntity<ProgressionModels.SubmitResult> submit(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user,
                                                                 @Valid @RequestBody SubmitRequest request) {
        return ResponseEntity.ok(progressionService.submitAssessment(
                user.userId(), request.domain(), request.stepIndex(), request.answers()));
    }

    public record SubmitRequest(@NotBlank String domain,
                                @NotNull Integer stepIndex,
                                @NotNull List<Integer> answers) {}
}
