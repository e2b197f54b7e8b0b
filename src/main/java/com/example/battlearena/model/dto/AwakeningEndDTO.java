package com.example.battlearena.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AwakeningEndDTO {
    private String sessionId;
    private String combatantName;
    private String character;
}
