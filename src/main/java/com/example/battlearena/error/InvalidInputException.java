package com.example.battlearena.error;

public class InvalidInputException extends GameException {
    public InvalidInputException(String detail) {
        super(GameErrorCode.INVALID_INPUT_VALUE, detail);
    }

    protected InvalidInputException(ErrorCode errorCode, Object... args) {
        super(errorCode, args);
    }
}
