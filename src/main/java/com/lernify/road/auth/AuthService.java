package com.lernify.road.auth;

import com.lernify.road.auth.AuthModels.*;
import com.lernify.road.catalog.CurriculumCatalog;
import com.lernify.road.error.ConflictException;
import com.lernify.road.error.InvalidRequestException;
import com.lernify.road.error.UnauthorizedException;
import com.lernify.road.repository.ProgressJdbcRepository;
import com.lernify.road.repository.UserJdbcRepository;
import com.lernify.road.repository.UserJdbcRepository.UserRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final UserJdbcRepository userRepository;
    private final ProgressJdbcRepository progressRepository;
    private final CurriculumCatalog catalog;
    private final PasswordEncoder passwordEncoder;
    private final BytesKeyGenerator tokenGenerator;

    public AuthService(UserJdbcRepository userRepository,
                       ProgressJdbcRepository progressRepository,
                       CurriculumCatalog catalog,
                       PasswordEncoder passwordEncoder,
                       @Value("${lernify.auth.token-bytes:24}") int tokenBytes) {
        this.userRepository = userRepository;
        this.progressRepository = progressRepository;
        this.catalog = catalog;
        this.passwordEncoder = passwordEncoder;
        this.tokenGenerator = KeyGenerators.secureRandom(tokenBytes);
    }

    @Transactional
    public RegisterResponse register(RegisterRequest request) {
        if (!Qualifications.ALLOWED.contains(request.qualification())) {
            throw new InvalidRequestException("Only IT-related student qualifications are allowed");
        }
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Email already registered");
        }

        String userId = UUID.randomUUID().toString();
        userRepository.insert(new UserRow(userId,
                request.firstName().trim(),
                request.lastName().trim(),
                email,
                request.phone().trim(),
                request.qualification(),
                passwordEncoder.encode(request.password())));
        progressRepository.initialise(userId, catalog.domains());

        log.info("Registered user {}", userId);
        return new RegisterResponse(true, userId);
    }

    public LoginResponse login(LoginRequest request) {
        Optional<UserRow> user = userRepository.findByEmail(normalizeEmail(request.email()));
        if (user.isEmpty() || !passwordEncoder.matches(request.password(), user.get().passwordHash())) {
            throw new UnauthorizedException("Invalid credentials");
        }
        String token = new String(Hex.encode(tokenGenerator.generateKey()));
        userRepository.addToken(user.get().id(), token);
        log.info("User {} logged in", user.get().id());
        return new LoginResponse(token, user.get().firstName(), user.get().lastName());
    }

    public void changePassword(String userId, ChangePasswordRequest request) {
        UserRow user = userRepository.findById(userId)
                .orElseThrow(() -> new UnauthorizedException("Invalid token"));
        if (!passwordEncoder.matches(request.oldPassword(), user.passwordHash())) {
            throw new InvalidRequestException("Old password incorrect");
        }
        userRepository.updatePasswordHash(userId, passwordEncoder.encode(request.newPassword()));
        log.info("Password changed for user {}", userId);
    }

    /**
     * Resolves the value of an {@code Authorization} header. The {@code Bearer } prefix is optional.
     */
    public AuthenticatedUser authenticate(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new UnauthorizedException("Missing Authorization token");
        }
        String token = authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length()).trim()
                : authorization.trim();
        UserRow user = userRepository.findByToken(token)
                .orElseThrow(() -> new UnauthorizedException("Invalid token"));
        return new AuthenticatedUser(user.id(), user.email());
    }

    private String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
