package com.example.battlearena.model.domain;

public enum ActionRejection {
    INVALID_ACTION, // wrong phase, wrong turn, unknown action or not a participant
    NOT_ELIGIBLE    // ability requested without a qualifying collectible or already used
}
