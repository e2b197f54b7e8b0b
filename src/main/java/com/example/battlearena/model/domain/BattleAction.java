package com.example.battlearena.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BattleAction {
    FAST_ATTACK("fast_attack"),
    STRONG_ATTACK("strong_attack"),
    DEFEND("defend"),
    USE_ABILITY("use_ability"),
    AWAKENED_ABILITY("awakened_ability");

    private final String wireName;

    BattleAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * @return the matching action, or {@code null} for anything the client should not send
     */
    @JsonCreator
    public static BattleAction fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (BattleAction action : values()) {
            if (action.wireName.equalsIgnoreCase(value.trim())) {
                return action;
            }
        }
        return null;
    }
}
