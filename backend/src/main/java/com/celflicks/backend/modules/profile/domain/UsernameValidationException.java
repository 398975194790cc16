package com.celflicks.backend.modules.profile.domain;

import com.celflicks.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class UsernameValidationException extends ProblemException {

    public static final String USERNAME_REQUIRED = "USERNAME_REQUIRED";
    public static final String INVALID_USERNAME_FORMAT = "INVALID_USERNAME_FORMAT";

    private UsernameValidationException(String code, String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
    }

    public static UsernameValidationException required() {
        return new UsernameValidationException(USERNAME_REQUIRED, "username required");
    }

    public static UsernameValidationException invalidFormat() {
        return new UsernameValidationException(INVALID_USERNAME_FORMAT, "invalid username format");
    }
}
