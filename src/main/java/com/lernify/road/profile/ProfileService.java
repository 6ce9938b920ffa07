package com.lernify.road.profile;

import com.lernify.road.error.UnauthorizedException;
import com.lernify.road.repository.ProgressJdbcRepository;
import com.lernify.road.repository.UserJdbcRepository;
import com.lernify.road.repository.UserJdbcRepository.UserRow;
import org.springframework.stereotype.Service;

@Service
public class ProfileService {
    private final UserJdbcRepository userRepository;
    private final ProgressJdbcRepository progressRepository;

    public ProfileService(UserJdbcRepository userRepository, ProgressJdbcRepository progressRepository) {
        this.userRepository = userRepository;
        this.progressRepository = progressRepository;
    }

    public ProfileModels.Profile profile(String userId) {
        UserRow user = load(userId);
        return new ProfileModels.Profile(user.firstName(), user.lastName(), user.email(), user.phone(),
                user.qualification(), progressRepository.progress(userId));
    }

    public void update(String userId, ProfileModels.UpdateProfileRequest request) {
        load(userId);
        if (request.firstName() == null && request.lastName() == null && request.phone() == null) return;
        userRepository.updateProfile(userId, trim(request.firstName()), trim(request.lastName()), trim(request.phone()));
    }

    private UserRow load(String userId) {
        return userRepository.findById(userId).orElseThrow(() -> new UnauthorizedException("Invalid token"));
    }

    private String trim(String value) {
        return value == null ? null : value.trim();
    }
}
