package com.example.battlearena.model.dto;

import com.example.battlearena.model.domain.BattleAction;
import lombok.Data;

@Data
public class BattleActionRequest {
    private BattleAction action; // null when the client sent an unknown name
}
