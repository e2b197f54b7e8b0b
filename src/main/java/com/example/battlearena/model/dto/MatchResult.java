package com.example.battlearena.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Matchmaking status for one player. {@code sessionId} and the side are set once a match is found.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {

    public enum Status {
        SEARCHING,
        ALREADY_QUEUED,
        ALREADY_IN_BATTLE,
        MATCH_FOUND,
        CANCELLED
    }

    private Status status;
    private String sessionId;
    private String assignedPlayerId; // "p1" or "p2"
    private String p1Username;
    private String p2Username;
    private String message;

    public static MatchResult status(Status status, String message) {
        MatchResult result = new MatchResult();
        result.status = status;
        result.message = message;
        return result;
    }
}
