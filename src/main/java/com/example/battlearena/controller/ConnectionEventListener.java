package com.example.battlearena.controller;

import com.example.battlearena.model.domain.User;
import com.example.battlearena.registry.ConnectionRegistry;
import com.example.battlearena.service.BattleService;
import com.example.battlearena.service.MatchmakingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * Tracks open STOMP connections. A closed connection forfeits or discards its battle and
 * leaves the match queue.
 */
@Slf4j
@Component
public class ConnectionEventListener {

    private final ConnectionRegistry connections;
    private final BattleService battleService;
    private final MatchmakingService matchmakingService;

    public ConnectionEventListener(ConnectionRegistry connections, BattleService battleService,
            MatchmakingService matchmakingService) {
        this.connections = connections;
        this.battleService = battleService;
        this.matchmakingService = matchmakingService;
    }

    @EventListener
    public void handleConnected(SessionConnectedEvent event) {
        String connectionId = StompHeaderAccessor.wrap(event.getMessage()).getSessionId();
        User user = PrincipalUsers.toUser(event.getUser());
        if (user != null) {
            connections.register(connectionId, user.getId());
            log.debug("Connection {} opened for user {}", connectionId, user.getId());
        }
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        Long userId = connections.unregister(connectionId);
        log.debug("Connection {} closed (user {})", connectionId, userId);
        matchmakingService.onDisconnect(connectionId);
        battleService.onDisconnect(connectionId);
    }
}
