package com.example.battlearena.error;

public class InsufficientFundsException extends GameException {
    public InsufficientFundsException(long cost) {
        super(GameErrorCode.INSUFFICIENT_FUNDS, cost);
    }
}
