package com.celflicks.backend.modules.profile.application;

import java.util.UUID;

import com.celflicks.backend.global.error.ProblemException;
import com.celflicks.backend.global.persistence.UniqueViolations;
import com.celflicks.backend.modules.profile.domain.Profile;
import com.celflicks.backend.modules.profile.domain.UsernameConflictException;
import com.celflicks.backend.modules.profile.domain.UsernamePolicy;
import com.celflicks.backend.modules.profile.infrastructure.persistence.ProfileRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProfileService {

    private final ProfileRepository profileRepository;
    private final AvatarUrlResolver avatarUrlResolver;

    public ProfileService(ProfileRepository profileRepository, AvatarUrlResolver avatarUrlResolver) {
        this.profileRepository = profileRepository;
        this.avatarUrlResolver = avatarUrlResolver;
    }

    @Transactional(readOnly = true)
    public Profile getProfile(UUID userId) {
        return profileRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PROFILE_NOT_FOUND"));
    }

    /**
     * Updates the caller's own profile. {@code null} fields are left untouched; a blank avatar
     * falls back to the placeholder of the (possibly new) username.
     */
    public Profile updateOwnProfile(UUID ownerId, UpdateProfileCommand command) {
        Profile profile = getProfile(ownerId);

        if (command.username() != null) {
            String username = UsernamePolicy.requireValid(command.username());
            if (profileRepository.existsByUsernameIgnoreCaseAndIdNot(username, ownerId)) {
                throw new UsernameConflictException(username);
            }
            profile.setUsername(username);
        }

        if (command.avatarUrl() != null) {
            profile.setAvatarUrl(avatarUrlResolver.resolve(command.avatarUrl(), profile.getUsername()));
        }

        try {
            return profileRepository.saveAndFlush(profile);
        } catch (DataIntegrityViolationException ex) {
            if (UniqueViolations.isUsernameViolation(ex)) {
                throw new UsernameConflictException(profile.getUsername());
            }
            throw ex;
        }
    }

    public record UpdateProfileCommand(String username, String avatarUrl) {
    }
}
