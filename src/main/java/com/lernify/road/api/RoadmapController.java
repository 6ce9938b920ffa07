package com.lernify.road.api;

import com.lernify.road.auth.AuthModels;
import com.lernify.road.auth.BearerTokenFilter;
import com.lernify.road.progression.ProgressionModels;
import com.lernify.road.progression.ProgressionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class RoadmapController {
    private final ProgressionService progressionService;

    public RoadmapController(ProgressionService progressionService) {
        this.progressionService = progressionService;
    }

    @GetMapping("/domains")
    public ResponseEntity<Map<String, List<String>>> domains() {
        return ResponseEntity.ok(Map.of("domains", progressionService.listDomains()));
    }

    // domain names may contain '/', so they travel as a query parameter
    @GetMapping("/roadmap")
    public ResponseEntity<ProgressionModels.RoadmapView> roadmap(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user,
                                                                 @RequestParam String domain) {
        return ResponseEntity.ok(progressionService.roadmap(user.userId(), domain));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<ProgressionModels.DashboardView> dashboard(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user) {
        return ResponseEntity.ok(progressionService.dashboard(user.userId()));
    }
}
