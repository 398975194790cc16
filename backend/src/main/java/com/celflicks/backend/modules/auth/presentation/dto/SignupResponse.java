package com.celflicks.backend.modules.auth.presentation.dto;

import com.celflicks.backend.modules.profile.presentation.dto.ProfileResponse;

public record SignupResponse(ProfileResponse profile, AccessTokenResponse token) {
}
