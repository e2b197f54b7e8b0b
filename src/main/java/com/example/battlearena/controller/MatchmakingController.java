package com.example.battlearena.controller;

import com.example.battlearena.error.ErrorResponse;
import com.example.battlearena.error.GameErrorCode;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.service.BattleNotifier;
import com.example.battlearena.service.MatchmakingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Slf4j
@Controller
public class MatchmakingController {

    private final MatchmakingService matchmakingService;
    private final BattleNotifier notifier;

    public MatchmakingController(MatchmakingService matchmakingService, BattleNotifier notifier) {
        this.matchmakingService = matchmakingService;
        this.notifier = notifier;
    }

    /**
     * Client sends to: /app/matchmaking/find
     */
    @MessageMapping("/matchmaking/find")
    public void findMatch(Principal principal, SimpMessageHeaderAccessor headers) {
        User user = PrincipalUsers.toUser(principal);
        if (user == null) {
            return;
        }
        log.debug("Match request from {} (ID: {})", user.getUsername(), user.getId());
        try {
            matchmakingService.findMatch(user.getId(), user.getUsername(), headers.getSessionId());
        } catch (RuntimeException e) {
            log.error("Matchmaking failed for user {}", user.getId(), e);
            notifier.error(user.getId(), ErrorResponse.of(GameErrorCode.INTERNAL_SERVER_ERROR));
        }
    }
}
