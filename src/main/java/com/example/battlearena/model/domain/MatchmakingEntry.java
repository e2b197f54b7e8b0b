package com.example.battlearena.model.domain;

import lombok.Data;

@Data
public class MatchmakingEntry {
    private final Long userId;
    private final String username;
    private final String connectionId;
    private final PlayerBuild build; // computed when the player queued
    private final long enqueuedAt;
}
