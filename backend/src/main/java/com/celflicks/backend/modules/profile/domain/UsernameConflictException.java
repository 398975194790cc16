package com.celflicks.backend.modules.profile.domain;

import com.celflicks.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class UsernameConflictException extends ProblemException {

    public static final String USERNAME_ALREADY_EXISTS = "USERNAME_ALREADY_EXISTS";

    private final String username;

    public UsernameConflictException(String username) {
        super(HttpStatus.CONFLICT, USERNAME_ALREADY_EXISTS, "username already exists");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
