package com.example.schoolidentity.controller;

import com.example.schoolidentity.dto.ChangePasswordRequest;
import com.example.schoolidentity.dto.CreateStaffRequest;
import com.example.schoolidentity.dto.LoginRequest;
import com.example.schoolidentity.dto.LoginResponse;
import com.example.schoolidentity.dto.PrincipalResponse;
import com.example.schoolidentity.dto.RegisterAdminRequest;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.security.RequireRoles;
import com.example.schoolidentity.security.ResolvedPrincipal;
import com.example.schoolidentity.service.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Staff authentication and account bootstrap.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * POST /api/auth/login
     *
     * @return 200 OK with credential and principal
     * @throws com.example.schoolidentity.exception.InvalidCredentialsException 401
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.staffLogin(request));
    }

    /**
     * POST /api/auth/register - global admin, requires the registration secret.
     *
     * @return 201 Created with credential
     */
    @PostMapping("/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterAdminRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.registerAdmin(request));
    }

    /**
     * GET /api/auth/me - the principal the request guard resolved.
     */
    @GetMapping("/me")
    public ResponseEntity<PrincipalResponse> me(@AuthenticationPrincipal ResolvedPrincipal principal) {
        return ResponseEntity.ok(PrincipalResponse.from(principal));
    }

    /**
     * POST /api/auth/change-password - any signed-in principal.
     *
     * @return 204 No Content
     * @throws com.example.schoolidentity.exception.BadRequestException 400 when the current password is wrong
     */
    @PostMapping("/change-password")
    public ResponseEntity<Void> changePassword(
            @Valid @RequestBody ChangePasswordRequest request,
            @AuthenticationPrincipal ResolvedPrincipal principal) {
        authService.changePassword(principal, request);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/staff")
    @RequireRoles({Role.ADMIN, Role.SCHOOL_ADMIN})
    public ResponseEntity<PrincipalResponse> createStaff(
            @Valid @RequestBody CreateStaffRequest request,
            @AuthenticationPrincipal ResolvedPrincipal principal) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.createStaff(request, principal));
    }
}
