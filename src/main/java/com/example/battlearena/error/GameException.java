package com.example.battlearena.error;

import lombok.Getter;

/**
 * Base class of every failure the game reports to a client. The message is the error code's
 * template formatted with the constructor arguments.
 */
@Getter
public abstract class GameException extends RuntimeException {
    private final ErrorCode errorCode;

    protected GameException(ErrorCode errorCode, Object... args) {
        super(String.format(errorCode.getMessage(), args));
        this.errorCode = errorCode;
    }

    protected GameException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(String.format(errorCode.getMessage(), args), cause);
        this.errorCode = errorCode;
    }
}
