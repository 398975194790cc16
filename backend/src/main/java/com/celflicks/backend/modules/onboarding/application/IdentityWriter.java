package com.celflicks.backend.modules.onboarding.application;

import java.util.UUID;

/**
 * Writes the identity row of a new account inside the provisioning attempt, so that a failed attempt
 * rolls the account back together with its profile.
 */
@FunctionalInterface
public interface IdentityWriter {

    /** For identities that were committed before provisioning started. */
    IdentityWriter NONE = userId -> {
    };

    void write(UUID userId);
}
