package com.example.schoolidentity.controller;

import com.example.schoolidentity.dto.GuardianLinksResponse;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.security.RequireRoles;
import com.example.schoolidentity.security.ResolvedPrincipal;
import com.example.schoolidentity.service.GuardianLinkService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guardians")
@RequireRoles({Role.ADMIN, Role.SCHOOL_ADMIN})
@RequiredArgsConstructor
public class GuardianController {

    private final GuardianLinkService guardianLinkService;

    @PostMapping("/{guardianId}/students/{studentId}")
    public ResponseEntity<GuardianLinksResponse> link(
            @PathVariable String guardianId,
            @PathVariable String studentId,
            @AuthenticationPrincipal ResolvedPrincipal principal) {
        return ResponseEntity.ok(guardianLinkService.link(guardianId, studentId, principal));
    }

    @DeleteMapping("/{guardianId}/students/{studentId}")
    public ResponseEntity<GuardianLinksResponse> unlink(
            @PathVariable String guardianId,
            @PathVariable String studentId,
            @AuthenticationPrincipal ResolvedPrincipal principal) {
        return ResponseEntity.ok(guardianLinkService.unlink(guardianId, studentId, principal));
    }
}
