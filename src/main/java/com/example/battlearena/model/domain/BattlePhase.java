package com.example.battlearena.model.domain;

public enum BattlePhase {
    AWAITING_ACTION,     // waiting for the player whose turn it is
    RESOLVING_ACTION,    // a submitted action is being applied
    AWAKENING,           // awakening cutscene delay is running
    AWAITING_OPPONENT,   // scripted opponent turn is scheduled (PvE)
    RESOLVING_OPPONENT,  // scripted opponent turn is being applied (PvE)
    FINISHED
}
