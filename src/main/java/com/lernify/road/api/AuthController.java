package com.lernify.road.api;

import com.lernify.road.auth.AuthModels;
import com.lernify.road.auth.AuthService;
import com.lernify.road.auth.BearerTokenFilter;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthModels.RegisterResponse> register(@Valid @RequestBody AuthModels.RegisterRequest request) {
        return ResponseEntity.ok(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthModels.LoginResponse> login(@Valid @RequestBody AuthModels.LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/change-password")
    public ResponseEntity<Map<String, Boolean>> changePassword(@RequestAttribute(BearerTokenFilter.USER_ATTRIBUTE) AuthModels.AuthenticatedUser user,
                                                               @Valid @RequestBody AuthModels.ChangePasswordRequest request) {
        authService.changePassword(user.userId(), request);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
