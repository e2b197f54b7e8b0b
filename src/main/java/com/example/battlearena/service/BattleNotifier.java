package com.example.battlearena.service;

import com.example.battlearena.error.ErrorResponse;
import com.example.battlearena.model.dto.AwakeningDTO;
import com.example.battlearena.model.dto.AwakeningEndDTO;
import com.example.battlearena.model.dto.BattleEndDTO;
import com.example.battlearena.model.dto.BattleUpdateDTO;
import com.example.battlearena.model.dto.MatchResult;
import com.example.battlearena.model.dto.NotificationDTO;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes events to a player's private queues, {@code /queue/<event>-{userId}}.
 */
@Service
public class BattleNotifier {

    static final String BATTLE_UPDATE = "battle-update";
    static final String BATTLE_END = "battle-end";
    static final String AWAKENING = "awakening";
    static final String OPPONENT_AWAKENING = "opponent-awakening";
    static final String AWAKENING_END = "awakening-end";
    static final String OPPONENT_DISCONNECTED = "opponent-disconnected";
    static final String MATCHMAKING = "matchmaking";
    static final String NOTIFICATIONS = "notifications";
    static final String ERRORS = "errors";

    private final SimpMessagingTemplate messagingTemplate;

    public BattleNotifier(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public static String destination(String event, Long userId) {
        return "/queue/" + event + "-" + userId;
    }

    public void battleUpdate(Long userId, BattleUpdateDTO update) {
        send(BATTLE_UPDATE, userId, update);
    }

    public void battleEnd(Long userId, BattleEndDTO end) {
        send(BATTLE_END, userId, end);
    }

    public void awakening(Long userId, AwakeningDTO awakening) {
        send(AWAKENING, userId, awakening);
    }

    public void opponentAwakening(Long userId, AwakeningDTO awakening) {
        send(OPPONENT_AWAKENING, userId, awakening);
    }

    public void awakeningEnd(Long userId, AwakeningEndDTO end) {
        send(AWAKENING_END, userId, end);
    }

    public void opponentDisconnected(Long userId, String sessionId) {
        send(OPPONENT_DISCONNECTED, userId, sessionId);
    }

    public void matchmaking(Long userId, MatchResult result) {
        send(MATCHMAKING, userId, result);
    }

    public void notification(Long userId, NotificationDTO notification) {
        send(NOTIFICATIONS, userId, notification);
    }

    public void error(Long userId, ErrorResponse error) {
        send(ERRORS, userId, error);
    }

    private void send(String event, Long userId, Object payload) {
        if (userId == null) {
            return; // scripted opponents have no queue
        }
        messagingTemplate.convertAndSend(destination(event, userId), payload);
    }
}
