package com.celflicks.backend.global.security;

import java.io.IOException;

import com.celflicks.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * 보안 필터 체인에서 거부된 요청을 컨트롤러 오류와 같은 problem JSON으로 응답한다.
 */
@Component
public class RestSecurityProblemHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    static final String UNAUTHORIZED = "UNAUTHORIZED";
    static final String FORBIDDEN = "FORBIDDEN";

    private final ObjectMapper objectMapper;

    public RestSecurityProblemHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        write(response, ProblemResponse.of(HttpStatus.UNAUTHORIZED, UNAUTHORIZED, "authentication required", request.getRequestURI()));
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        write(response, ProblemResponse.of(HttpStatus.FORBIDDEN, FORBIDDEN, "access denied", request.getRequestURI()));
    }

    private void write(HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
