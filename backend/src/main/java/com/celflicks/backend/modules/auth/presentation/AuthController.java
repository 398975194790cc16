package com.celflicks.backend.modules.auth.presentation;

import com.celflicks.backend.modules.auth.application.AccountService;
import com.celflicks.backend.modules.auth.presentation.dto.LoginRequest;
import com.celflicks.backend.modules.auth.presentation.dto.LoginResponse;
import com.celflicks.backend.modules.auth.presentation.dto.SignupRequest;
import com.celflicks.backend.modules.auth.presentation.dto.SignupResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AccountService accountService;

    public AuthController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "회원 가입", description = "계정을 만들고 프로필, 지갑, 환영 알림을 함께 생성합니다.")
    @PostMapping("/auth/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.signup(request));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(accountService.login(request));
    }
}
