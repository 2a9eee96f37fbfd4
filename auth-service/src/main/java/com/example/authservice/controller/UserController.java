package com.example.authservice.controller;

import com.example.authservice.config.OpenApiConfig;
import com.example.authservice.dto.ProfileResponse;
import com.example.authservice.dto.RoleUpdateRequest;
import com.example.authservice.dto.RoleUpdateResponse;
import com.example.authservice.dto.UserListResponse;
import com.example.authservice.exception.ValidationException;
import com.example.authservice.service.AuthService;
import com.example.authservice.web.Authenticated;
import com.example.authservice.web.RequireRole;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * User administration endpoints. Every handler requires an authenticated admin.
 */
@RestController
@RequestMapping("/api/users")
@Authenticated
@Tag(name = "Users", description = "User administration")
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
@RequiredArgsConstructor
public class UserController {

    private final AuthService authService;

    @RequireRole("admin")
    @Operation(summary = "List all users (admin)")
    @GetMapping
    public ResponseEntity<UserListResponse> listUsers() {
        return ResponseEntity.ok(UserListResponse.of(authService.listUsers()));
    }

    @RequireRole("admin")
    @Operation(
            summary = "Get a user by id (admin)",
            responses = {
                    @ApiResponse(responseCode = "200", description = "User found"),
                    @ApiResponse(responseCode = "400", description = "Invalid user ID"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            })
    @GetMapping("/{id}")
    public ResponseEntity<ProfileResponse> getUser(
            @Parameter(description = "User ID") @PathVariable long id) {
        return ResponseEntity.ok(ProfileResponse.of(authService.getProfile(requireValidId(id))));
    }

    /**
     * Change a user's role. Existing tokens keep their old role claim until they expire.
     */
    @RequireRole("admin")
    @Operation(
            summary = "Update a user's role (admin)",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Role updated"),
                    @ApiResponse(responseCode = "400", description = "Invalid user ID or role"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            })
    @PatchMapping("/{id}/role")
    public ResponseEntity<RoleUpdateResponse> updateRole(
            @Parameter(description = "User ID") @PathVariable long id,
            @Valid @RequestBody RoleUpdateRequest request) {
        return ResponseEntity.ok(RoleUpdateResponse.of(authService.updateRole(requireValidId(id), request.role())));
    }

    private static long requireValidId(long id) {
        if (id <= 0) {
            throw ValidationException.invalidUserId();
        }
        return id;
    }
}
