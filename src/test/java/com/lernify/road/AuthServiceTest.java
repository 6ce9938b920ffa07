package com.lernify.road;

import com.lernify.road.auth.AuthModels;
import com.lernify.road.auth.AuthService;
import com.lernify.road.catalog.CurriculumCatalog;
import com.lernify.road.error.ConflictException;
import com.lernify.road.error.ErrorKind;
import com.lernify.road.error.InvalidRequestException;
import com.lernify.road.error.UnauthorizedException;
import com.lernify.road.profile.ProfileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AuthServiceTest {
    @Autowired
    private AuthService authService;
    @Autowired
    private CurriculumCatalog catalog;
    @Autowired
    private ProfileService profileService;

    @Test
    void registersLogsInAndResolvesBearerToken() {
        String email = TestUsers.uniqueEmail();
        var registered = authService.register(TestUsers.registration(email));
        assertTrue(registered.ok());

        var login = authService.login(new AuthModels.LoginRequest(email.toUpperCase(), TestUsers.PASSWORD));
        assertEquals("Asha", login.firstName());
        assertEquals(48, login.token().length());

        var user = authService.authenticate("Bearer " + login.token());
        assertEquals(registered.userId(), user.userId());
        assertEquals(email, user.email());

        var progress = profileService.profile(user.userId()).progress();
        assertEquals(catalog.domains().size(), progress.size());
        progress.values().forEach(v -> assertEquals(0, v));

        assertEquals(registered.userId(), authService.authenticate(login.token()).userId());
    }

    @Test
    void eachLoginIssuesAnotherValidToken() {
        String email = TestUsers.uniqueEmail();
        authService.register(TestUsers.registration(email));
        String first = authService.login(new AuthModels.LoginRequest(email, TestUsers.PASSWORD)).token();
        String second = authService.login(new AuthModels.LoginRequest(email, TestUsers.PASSWORD)).token();

        assertNotEquals(first, second);
        assertEquals(authService.authenticate(first).userId(), authService.authenticate(second).userId());
    }

    @Test
    void rejectsDuplicateEmailAndForeignQualification() {
        String email = TestUsers.uniqueEmail();
        authService.register(TestUsers.registration(email));
        assertThrows(ConflictException.class, () -> authService.register(TestUsers.registration(email.toUpperCase())));

        var lawStudent = new AuthModels.RegisterRequest("Ravi", "Kumar", TestUsers.uniqueEmail(), "9876543210", "LLB", "secret-pass");
        InvalidRequestException e = assertThrows(InvalidRequestException.class, () -> authService.register(lawStudent));
        assertEquals("Only IT-related student qualifications are allowed", e.getMessage());
    }

    @Test
    void rejectsBadCredentialsAndTokens() {
        String email = TestUsers.uniqueEmail();
        authService.register(TestUsers.registration(email));

        assertThrows(UnauthorizedException.class, () -> authService.login(new AuthModels.LoginRequest(email, "wrong-pass")));
        assertThrows(UnauthorizedException.class, () -> authService.login(new AuthModels.LoginRequest(TestUsers.uniqueEmail(), TestUsers.PASSWORD)));

        UnauthorizedException missing = assertThrows(UnauthorizedException.class, () -> authService.authenticate(null));
        assertEquals(ErrorKind.UNAUTHORIZED, missing.kind());
        assertEquals("Missing Authorization token", missing.getMessage());
        assertEquals("Invalid token", assertThrows(UnauthorizedException.class,
                () -> authService.authenticate("Bearer not-a-token")).getMessage());
    }

    @Test
    void changesPasswordOnlyWithTheOldOne() {
        String email = TestUsers.uniqueEmail();
        String userId = authService.register(TestUsers.registration(email)).userId();

        assertThrows(InvalidRequestException.class,
                () -> authService.changePassword(userId, new AuthModels.ChangePasswordRequest("nope-nope", "brand-new-pass")));

        authService.changePassword(userId, new AuthModels.ChangePasswordRequest(TestUsers.PASSWORD, "brand-new-pass"));
        assertThrows(UnauthorizedException.class, () -> authService.login(new AuthModels.LoginRequest(email, TestUsers.PASSWORD)));
        assertNotNull(authService.login(new AuthModels.LoginRequest(email, "brand-new-pass")).token());
    }
}
