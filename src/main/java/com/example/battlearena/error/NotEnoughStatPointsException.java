package com.example.battlearena.error;

public class NotEnoughStatPointsException extends InvalidInputException {
    public NotEnoughStatPointsException(int requested) {
        super(GameErrorCode.NOT_ENOUGH_STAT_POINTS, requested);
    }
}
