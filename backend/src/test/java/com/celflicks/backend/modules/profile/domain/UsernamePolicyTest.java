package com.celflicks.backend.modules.profile.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class UsernamePolicyTest {

    @ParameterizedTest
    @ValueSource(strings = {"abc", "alice_01", "Bob-7", "A_B-C_d", "abcdefghijklmnopqrst"})
    void acceptsWellFormedUsernames(String username) {
        assertThat(UsernamePolicy.requireValid(username)).isEqualTo(username);
    }

    @ParameterizedTest
    @ValueSource(strings = {"  alice_01  ", "\talice_01\n"})
    void trimsSurroundingWhitespace(String username) {
        assertThat(UsernamePolicy.requireValid(username)).isEqualTo("alice_01");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t"})
    void missingUsernameIsRequired(String username) {
        assertThatThrownBy(() -> UsernamePolicy.requireValid(username))
                .isInstanceOf(UsernameValidationException.class)
                .hasFieldOrPropertyWithValue("code", UsernameValidationException.USERNAME_REQUIRED)
                .hasFieldOrPropertyWithValue("detailMessage", "username required");
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "abcdefghijklmnopqrstu", "bad name", "alice.01", "josé", "hi!"})
    void malformedUsernameIsRejected(String username) {
        assertThatThrownBy(() -> UsernamePolicy.requireValid(username))
                .isInstanceOf(UsernameValidationException.class)
                .hasFieldOrPropertyWithValue("code", UsernameValidationException.INVALID_USERNAME_FORMAT)
                .hasFieldOrPropertyWithValue("detailMessage", "invalid username format");
    }
}
