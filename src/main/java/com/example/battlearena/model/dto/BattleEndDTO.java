package com.example.battlearena.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BattleEndDTO {

    public enum Reason {
        NORMAL,
        FORFEIT,
        STALE_SESSION
    }

    private String sessionId;
    private boolean win;
    private String message;
    private Reason reason;
    private long coinsDelta;
    private int xpGained;
}
