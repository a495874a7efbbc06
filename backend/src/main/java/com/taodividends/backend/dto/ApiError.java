package com.taodividends.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint, from controller advice and from the security handlers alike.
 * {@code error_code} is the status name, so clients can switch on it without parsing messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    private Instant timestamp;
    private String path;
    private int status;
    private String error;
    private String errorCode;
    private String message;
    private String requestId;
    private String correlationId;
    @Builder.Default
    private List<ApiErrorDetail> details = List.of();

    /**
     * Body for {@code status} on {@code path}, carrying the request and correlation ids of the
     * current request from the MDC.
     */
    public static ApiError of(HttpStatus status, String message, String path, List<ApiErrorDetail> details) {
        return ApiError.builder()
                .timestamp(Instant.now())
                .path(path)
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(status.name())
                .message(message)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .details(details)
                .build();
    }
}
