package com.celflicks.backend.support;

import java.util.HashMap;
import java.util.UUID;

import com.celflicks.backend.modules.auth.application.AccountService;
import com.celflicks.backend.modules.auth.domain.AppUser;
import com.celflicks.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.celflicks.backend.modules.auth.presentation.dto.SignupRequest;
import com.celflicks.backend.modules.auth.presentation.dto.SignupResponse;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "password123!";

    private final AppUserRepository appUserRepository;
    private final AccountService accountService;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            AppUserRepository appUserRepository,
            AccountService accountService,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.accountService = accountService;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Committed identity row without profile, as left by an external identity provider.
     */
    @Transactional
    public AppUser createIdentity(String email) {
        AppUser user = new AppUser(UUID.randomUUID());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setRawUserMetaData(new HashMap<>());
        return appUserRepository.saveAndFlush(user);
    }

    /**
     * Full signup: identity, profile, wallet and welcome notification plus an access token.
     */
    public SignupResponse signUp(String username) {
        return accountService.signup(new SignupRequest(
                username.toLowerCase() + "@example.com",
                DEFAULT_PASSWORD,
                username,
                null
        ));
    }
}
