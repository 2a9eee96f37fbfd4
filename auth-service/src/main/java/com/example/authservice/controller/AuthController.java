package com.example.authservice.controller;

import com.example.authservice.config.OpenApiConfig;
import com.example.authservice.dto.AuthResponse;
import com.example.authservice.dto.LoginRequest;
import com.example.authservice.dto.ProfileResponse;
import com.example.authservice.dto.RegisterRequest;
import com.example.authservice.dto.SessionResponse;
import com.example.authservice.service.AuthService;
import com.example.authservice.web.Authenticated;
import com.example.authservice.web.OptionalAuthentication;
import com.example.authservice.web.PrincipalContextHelper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication controller.
 *
 * - POST /api/auth/register: public
 * - POST /api/auth/login: public
 * - GET /api/auth/me: bearer token required
 * - GET /api/auth/session: bearer token optional
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication", description = "Registration, login and token introspection")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final PrincipalContextHelper principalContextHelper;

    /**
     * @return 201 Created with token and profile
     */
    @Operation(
            summary = "Register a new user",
            responses = {
                    @ApiResponse(responseCode = "201", description = "User created, token issued"),
                    @ApiResponse(responseCode = "400", description = "Validation error or unknown role"),
                    @ApiResponse(responseCode = "409", description = "Email already registered")
            })
    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(
            summary = "Login with email and password",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Login successful"),
                    @ApiResponse(responseCode = "401", description = "Invalid email or password")
            })
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * Profile of the authenticated user, read fresh from the store.
     */
    @Authenticated
    @Operation(summary = "Current user's profile")
    @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
    @GetMapping("/me")
    public ResponseEntity<ProfileResponse> me() {
        long userId = principalContextHelper.getCurrentUserId()
                .orElseThrow(() -> new IllegalStateException("Gate pipeline did not attach a principal"));
        return ResponseEntity.ok(ProfileResponse.of(authService.getProfile(userId)));
    }

    /**
     * Who the token says the caller is, without touching the store.
     * Invalid or missing tokens answer as anonymous instead of 401.
     */
    @OptionalAuthentication
    @Operation(summary = "Identity carried by the bearer token, if any")
    @GetMapping("/session")
    public ResponseEntity<SessionResponse> session() {
        return ResponseEntity.ok(principalContextHelper.getCurrentPrincipal()
                .map(SessionResponse::of)
                .orElseGet(SessionResponse::anonymous));
    }
}
