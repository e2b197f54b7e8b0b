package com.example.battlearena.controller;

import com.example.battlearena.error.ErrorResponse;
import com.example.battlearena.error.GameErrorCode;
import com.example.battlearena.error.GameException;
import com.example.battlearena.model.domain.User;
import com.example.battlearena.model.dto.BattleActionRequest;
import com.example.battlearena.service.BattleNotifier;
import com.example.battlearena.service.BattleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

@Slf4j
@Controller
public class BattleSocketController {

    private final BattleService battleService;
    private final BattleNotifier notifier;

    public BattleSocketController(BattleService battleService, BattleNotifier notifier) {
        this.battleService = battleService;
        this.notifier = notifier;
    }

    /**
     * Client sends to: /app/battle/start
     */
    @MessageMapping("/battle/start")
    public void startBattle(Principal principal, SimpMessageHeaderAccessor headers) {
        User user = PrincipalUsers.toUser(principal);
        if (user == null) {
            return;
        }
        try {
            battleService.startPveBattle(user.getId(), user.getUsername(), headers.getSessionId());
        } catch (GameException e) {
            notifier.error(user.getId(), ErrorResponse.of(e));
        } catch (RuntimeException e) {
            log.error("Start battle failed for user {}", user.getId(), e);
            notifier.error(user.getId(), ErrorResponse.of(GameErrorCode.INTERNAL_SERVER_ERROR));
        }
    }

    /**
     * Client sends to: /app/battle/{sessionId}/action with {@code {"action": "fast_attack"}}
     */
    @MessageMapping("/battle/{sessionId}/action")
    public void handleAction(@DestinationVariable String sessionId, BattleActionRequest request,
            Principal principal) {
        User user = PrincipalUsers.toUser(principal);
        if (user == null) {
            return;
        }
        try {
            battleService.submitAction(sessionId, user.getId(), request == null ? null : request.getAction());
        } catch (GameException e) {
            notifier.error(user.getId(), ErrorResponse.of(e));
        } catch (RuntimeException e) {
            log.error("Action failed in session {} for user {}", sessionId, user.getId(), e);
            notifier.error(user.getId(), ErrorResponse.of(GameErrorCode.INTERNAL_SERVER_ERROR));
        }
    }
}
