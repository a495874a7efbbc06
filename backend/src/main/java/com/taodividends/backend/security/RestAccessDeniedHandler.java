package com.taodividends.backend.security;

import com.taodividends.backend.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ApiErrorResponseWriter apiErrorResponseWriter;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("API client denied {} {}: {}", request.getMethod(), request.getRequestURI(),
                accessDeniedException.getMessage());
        apiErrorResponseWriter.write(response, ApiError.of(HttpStatus.FORBIDDEN,
                "API token lacks access to this endpoint", request.getRequestURI(), List.of()));
    }
}
