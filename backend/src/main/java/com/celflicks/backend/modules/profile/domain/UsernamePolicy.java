package com.celflicks.backend.modules.profile.domain;

import java.util.regex.Pattern;

/**
 * Username rules shared by provisioning and profile updates.
 */
public final class UsernamePolicy {

    public static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{3,20}$");

    private UsernamePolicy() {
    }

    /**
     * Trims the candidate and returns it when it is present and well formed.
     *
     * @throws UsernameValidationException {@code USERNAME_REQUIRED} for null/blank input,
     *                                     {@code INVALID_USERNAME_FORMAT} when the pattern does not match
     */
    public static String requireValid(String candidate) {
        String trimmed = candidate == null ? "" : candidate.trim();
        if (trimmed.isEmpty()) {
            throw UsernameValidationException.required();
        }
        if (!USERNAME_PATTERN.matcher(trimmed).matches()) {
            throw UsernameValidationException.invalidFormat();
        }
        return trimmed;
    }
}
