package com.celflicks.backend.modules.auth.application;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.global.persistence.UniqueViolations;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.celflicks.backend.modules.auth.presentation.dto.LoginRequest;
import com.celflicks.backend.modules.auth.presentation.dto.LoginResponse;
import com.celflicks.backend.modules.auth.presentation.dto.SignupRequest;
import com.celflicks.backend.modules.auth.presentation.dto.SignupResponse;
import com.celflicks.backend.modules.onboarding.application.IdentityWriter;
import com.celflicks.backend.modules.onboarding.application.UserProvisioningService;
import com.celflicks.backend.modules.onboarding.domain.ProvisionedUser;
import com.celflicks.backend.modules.profile.application.ProfileService;
import com.celflicks.backend.modules.profile.presentation.dto.ProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 가입과 로그인. 가입 시 계정 행은 프로비저닝 시도와 같은 트랜잭션에서 만들어지므로
 * 프로비저닝이 실패하면 계정도 남지 않는다.
 */
@Service
public class AccountService {

    static final String EMAIL_CONSTRAINT = "uq_app_user_email";

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AppUserRepository appUserRepository;
    private final UserProvisioningService provisioningService;
    private final ProfileService profileService;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AccountService(
            AppUserRepository appUserRepository,
            UserProvisioningService provisioningService,
            ProfileService profileService,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.provisioningService = provisioningService;
        this.profileService = profileService;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public SignupResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw emailAlreadyRegistered();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(UserProvisioningService.METADATA_USERNAME, request.username());
        metadata.put(UserProvisioningService.METADATA_AVATAR_URL, request.avatarUrl());
        String passwordHash = passwordEncoder.encode(request.password());

        UUID userId = UUID.randomUUID();
        IdentityWriter identityWriter = id -> {
            AppUser user = new AppUser(id);
            user.setEmail(email);
            user.setPasswordHash(passwordHash);
            user.setRawUserMetaData(new LinkedHashMap<>(metadata));
            appUserRepository.saveAndFlush(user);
        };

        ProvisionedUser provisioned;
        try {
            provisioned = provisioningService.provision(userId, metadata, identityWriter);
        } catch (DataIntegrityViolationException ex) {
            if (UniqueViolations.isConstraintViolation(ex, EMAIL_CONSTRAINT)) {
                throw emailAlreadyRegistered();
            }
            throw ex;
        }

        log.info("Signed up user {} ({})", provisioned.userId(), provisioned.username());
        ProfileResponse profile = ProfileResponse.from(profileService.getProfile(provisioned.userId()));
        return new SignupResponse(profile, jwtTokenService.issueAccessToken(provisioned.userId(), email));
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(AccountService::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }
        return new LoginResponse(user.getId(), jwtTokenService.issueAccessToken(user.getId(), user.getEmail()));
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static ProblemException emailAlreadyRegistered() {
        return new ProblemException(HttpStatus.CONFLICT, "EMAIL_ALREADY_REGISTERED", "email already registered");
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "invalid email or password");
    }
}
