package com.example.battlearena.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Cutscene cue: the caster gets its own ability, the other side gets the narrative lines. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AwakeningDTO {
    private String sessionId;
    private String character;
    private String abilityName;
    private List<String> messages;
    private String theme;
    private long durationMs;
}
