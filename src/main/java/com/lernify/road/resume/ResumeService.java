package com.lernify.road.resume;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lernify.road.error.UnauthorizedException;
import com.lernify.road.repository.ResumeJdbcRepository;
import com.lernify.road.repository.UserJdbcRepository;
import com.lernify.road.resume.ResumeModels.Resume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;

@Service
public class ResumeService {
    private static final Logger log = LoggerFactory.getLogger(ResumeService.class);

    private final ResumeJdbcRepository repository;
    private final UserJdbcRepository userRepository;
    private final ResumeHtmlRenderer renderer;
    private final ObjectMapper objectMapper;

    public ResumeService(ResumeJdbcRepository repository,
                         UserJdbcRepository userRepository,
                         ResumeHtmlRenderer renderer,
                         ObjectMapper objectMapper) {
        this.repository = repository;
        this.userRepository = userRepository;
        this.renderer = renderer;
        this.objectMapper = objectMapper;
    }

    public void save(String userId, Resume resume) {
        try {
            repository.upsert(userId, objectMapper.writeValueAsString(resume));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize resume for user " + userId, e);
        }
        log.info("Saved resume for user {}", userId);
    }

    public Resume get(String userId) {
        return repository.find(userId).map(this::read).orElseGet(Resume::empty);
    }

    public ResumeModels.ResumeHtml render(String userId) {
        var user = userRepository.findById(userId).orElseThrow(() -> new UnauthorizedException("Invalid token"));
        return new ResumeModels.ResumeHtml(renderer.render(user, get(userId)));
    }

    private Resume read(String json) {
        try {
            return objectMapper.readValue(json, Resume.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored resume is not valid JSON", e);
        }
    }
}
