package com.example.battlearena.error;

public class PlayerNotFoundException extends GameException {
    public PlayerNotFoundException(Long userId) {
        super(GameErrorCode.PLAYER_NOT_FOUND, userId);
    }
}
