package com.example.battlearena.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum GameErrorCode implements ErrorCode {
    // Client
    INVALID_INPUT_VALUE("G001", "Invalid input: %s", HttpStatus.BAD_REQUEST, false),
    PLAYER_NOT_FOUND("G002", "Player not found (id: %s)", HttpStatus.NOT_FOUND, false),
    INSUFFICIENT_FUNDS("G003", "Not enough coins (cost: %s)", HttpStatus.PAYMENT_REQUIRED, false),
    NOT_ENOUGH_STAT_POINTS("G004", "Not enough stat points to allocate %s", HttpStatus.BAD_REQUEST, false),

    // Server
    PERSISTENCE_FAILURE("S001", "Could not save your progress, please try again", HttpStatus.SERVICE_UNAVAILABLE, true),
    INTERNAL_SERVER_ERROR("S002", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final String code;
    private final String message;
    private final HttpStatus status;
    private final boolean retryable;
}
