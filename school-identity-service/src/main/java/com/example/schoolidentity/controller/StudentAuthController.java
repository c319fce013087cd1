package com.example.schoolidentity.controller;

import com.example.schoolidentity.dto.LoginResponse;
import com.example.schoolidentity.dto.SchoolLoginRequest;
import com.example.schoolidentity.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Learner and guardian login. Both accept an optional schoolId for emails registered
 * in more than one school; without it such an email gets 400 AMBIGUOUS_ACCOUNT.
 */
@RestController
@RequestMapping("/api/students")
@RequiredArgsConstructor
public class StudentAuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> studentLogin(@Valid @RequestBody SchoolLoginRequest request) {
        return ResponseEntity.ok(authService.studentLogin(request));
    }

    @PostMapping("/parents/login")
    public ResponseEntity<LoginResponse> guardianLogin(@Valid @RequestBody SchoolLoginRequest request) {
        return ResponseEntity.ok(authService.guardianLogin(request));
    }
}
