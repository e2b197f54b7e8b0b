package com.example.battlearena.error;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private int status;
    private String code;
    private String message;
    private boolean retryable;
    private LocalDateTime timestamp;

    public static ErrorResponse of(GameException e) {
        ErrorCode errorCode = e.getErrorCode();
        return new ErrorResponse(errorCode.getStatus().value(), errorCode.getCode(), e.getMessage(),
                errorCode.isRetryable(), LocalDateTime.now());
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getStatus().value(), errorCode.getCode(), errorCode.getMessage(),
                errorCode.isRetryable(), LocalDateTime.now());
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(GameException e) {
        return ResponseEntity.status(e.getErrorCode().getStatus()).body(of(e));
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return ResponseEntity.status(errorCode.getStatus()).body(of(errorCode));
    }
}
