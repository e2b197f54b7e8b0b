package com.example.battlearena.model.domain;

public enum BattleMode {
    PVE, // player vs scripted opponent
    PVP  // two connected players
}
