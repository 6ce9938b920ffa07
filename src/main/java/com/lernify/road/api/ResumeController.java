package com.lernify.road.api;

import com.lernify.road.auth.AuthModels;
import com.lernify.road.auth.BearerTokenFilter;
import com.lernify.road.resume.ResumeModels;
import com.lernify.road.resume.ResumeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/resume")
public class ResumeController {
    private final ResumeService resumeService;

    public ResumeController(ResumeService resumeService) {
        this.resumeService = resumeService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Boolean>> save(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user,
                                                     @RequestBody ResumeModels.Resume resume) {
        resumeService.save(user.userId(), resume);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @GetMapping
    public ResponseEntity<ResumeModels.Resume> get(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user) {
        return ResponseEntity.ok(resumeService.get(user.userId()));
    }

    @GetMapping("/download")
    public ResponseEntity<ResumeModels.ResumeHtml> download(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user) {
        return ResponseEntity.ok(resumeService.render(user.userId()));
    }
}
