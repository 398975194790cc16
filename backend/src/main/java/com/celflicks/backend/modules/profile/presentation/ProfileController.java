package com.celflicks.backend.modules.profile.presentation;

import java.util.UUID;

import com.celflicks.backend.global.security.SecurityUtils;
import com.celflicks.backend.modules.profile.application.ProfileService;
import com.celflicks.backend.modules.profile.application.ProfileService.UpdateProfileCommand;
import com.celflicks.backend.modules.profile.domain.Profile;
import com.celflicks.backend.modules.profile.presentation.dto.ProfileResponse;
import com.celflicks.backend.modules.profile.presentation.dto.UpdateProfileRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profiles")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @Operation(summary = "내 프로필 조회")
    @GetMapping("/me")
    public ResponseEntity<ProfileResponse> currentProfile() {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(ProfileResponse.from(profileService.getProfile(userId)));
    }

    @Operation(summary = "프로필 조회", description = "누구나 조회할 수 있습니다.")
    @GetMapping("/{userId}")
    public ResponseEntity<ProfileResponse> profile(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(ProfileResponse.from(profileService.getProfile(userId)));
    }

    @Operation(summary = "내 프로필 수정", description = "본인 프로필만 수정할 수 있습니다.")
    @PatchMapping("/me")
    public ResponseEntity<ProfileResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        Profile updated = profileService.updateOwnProfile(
                userId,
                new UpdateProfileCommand(request.username(), request.avatarUrl())
        );
        return ResponseEntity.ok(ProfileResponse.from(updated));
    }
}
